package site.respkv.command;

import lombok.extern.slf4j.Slf4j;
import site.respkv.core.KeyspaceStore;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

/**
 * 命令分发器
 *
 * <p>把一个解码后的RESP值变成一次命令执行：
 * <ul>
 *     <li>校验命令格式 - 必须是非空的、元素全为非null批量字符串的数组</li>
 *     <li>查找命令 - 命令名忽略大小写</li>
 *     <li>校验参数个数</li>
 *     <li>创建命令并执行</li>
 * </ul>
 *
 * <p>格式错误、未知命令和参数错误都以错误响应返回，连接保持打开；
 * 命令执行中未分类的异常不在这里捕获，由连接处理器统一处理。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    static final Errors INVALID_FORMAT_ERROR = new Errors("ERR Invalid command format");

    static final Errors UNKNOWN_COMMAND_ERROR = new Errors("ERR Unknown command");

    private final KeyspaceStore store;

    public CommandDispatcher(final KeyspaceStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store不能为null");
        }
        this.store = store;
    }

    /**
     * 分发一条命令
     *
     * @param msg 解码后的RESP值
     * @return 响应及是否关闭连接
     */
    public DispatchResult dispatch(final Resp msg) {
        // 1. 校验格式
        if (!isWellFormedCommand(msg)) {
            log.debug("命令格式错误: {}", msg);
            return DispatchResult.reply(INVALID_FORMAT_ERROR);
        }
        final Resp[] array = ((RespArray) msg).getContent();

        // 2. 查找命令
        final CommandType commandType = CommandType.findByBytes(((BulkString) array[0]).getContent());
        if (commandType == null) {
            log.debug("未知命令: {}", array[0]);
            return DispatchResult.reply(UNKNOWN_COMMAND_ERROR);
        }

        // 3. 校验参数个数
        if (!commandType.acceptsArity(array.length)) {
            return DispatchResult.reply(Errors.wrongArity(commandType.getLowerName()));
        }

        // 4. 执行
        final Command command = commandType.createCommand(store);
        command.setContext(array);
        final Resp reply = command.handle();
        return command.closesConnection()
                ? DispatchResult.replyAndClose(reply)
                : DispatchResult.reply(reply);
    }

    private static boolean isWellFormedCommand(final Resp msg) {
        if (!(msg instanceof RespArray)) {
            return false;
        }
        final Resp[] array = ((RespArray) msg).getContent();
        if (array == null || array.length == 0) {
            return false;
        }
        for (final Resp element : array) {
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                return false;
            }
        }
        return true;
    }
}
