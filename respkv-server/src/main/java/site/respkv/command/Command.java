package site.respkv.command;

import site.respkv.protocol.Resp;

/**
 * Redis命令接口
 *
 * <p>命令实例按请求创建：分发器先用 {@link #setContext(Resp[])} 注入参数，
 * 再调用 {@link #handle()} 执行。参数个数已由分发器按 {@link CommandType} 校验，
 * 实现类只处理参数内容。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface Command {

    /**
     * 设置命令参数
     *
     * @param array 完整的命令数组，下标0为命令名，元素均为非null的批量字符串
     */
    void setContext(Resp[] array);

    /**
     * 执行命令
     *
     * @return 响应
     */
    Resp handle();

    /**
     * 响应发送后是否关闭连接
     */
    default boolean closesConnection() {
        return false;
    }
}
