package site.respkv.protocol;

/**
 * 帧不完整：缓冲区在当前元素结束之前就已耗尽。
 *
 * <p>与一般的格式错误不同，流式读取方应当把它理解为"需要更多字节"，
 * 回退读指针后等待下一次读取，而不是关闭连接。
 *
 * @author respkv
 * @since 1.0.0
 */
public class IncompleteFrameException extends MalformedFrameException {

    private static final long serialVersionUID = 1L;

    public IncompleteFrameException(final String message) {
        super(message);
    }
}
