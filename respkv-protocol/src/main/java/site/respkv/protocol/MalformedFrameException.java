package site.respkv.protocol;

/**
 * 字节缓冲区中不包含格式正确的 RESP 元素时抛出。
 *
 * <p>典型场景：缺少行结束符、批量字符串被截断、长度或整数不是十进制数字、
 * 需要文本的位置出现非法 UTF-8。对连接而言这是致命错误。
 *
 * @author respkv
 * @since 1.0.0
 */
public class MalformedFrameException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedFrameException(final String message) {
        super(message);
    }

    public MalformedFrameException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
