package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;

/**
 * Redis错误消息类型
 *
 * <p>错误格式：
 * <ul>
 *     <li>语法："-Error message\r\n"</li>
 *     <li>示例："-ERR Unknown command"</li>
 *     <li>示例："-ERR wrong number of arguments for 'get' command"</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    public Errors(final String content) {
        this.content = content;
    }

    /**
     * 参数个数错误
     *
     * @param commandName 小写命令名
     * @return 错误响应
     */
    public static Errors wrongArity(final String commandName) {
        return new Errors("ERR wrong number of arguments for '" + commandName + "' command");
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }
}
