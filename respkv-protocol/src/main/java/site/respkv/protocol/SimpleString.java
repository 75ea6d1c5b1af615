package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;

/**
 * Redis简单字符串类型
 *
 * <p>格式："+OK\r\n"。内容为单行 UTF-8 文本，不允许包含CR或LF。
 *
 * <p>预定义常量：
 * <ul>
 *     <li>OK - 成功响应</li>
 *     <li>PONG - 心跳响应</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 预定义的心跳响应 */
    public static final SimpleString PONG = new SimpleString("PONG");

    /** 字符串内容 */
    private final String content;

    public SimpleString(final String content) {
        this.content = content;
    }


    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }
}
