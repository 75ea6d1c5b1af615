package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.respkv.datastructure.RedisBytes;

/**
 * Redis批量字符串类型
 *
 * <p>格式："$6\r\nfoobar\r\n"；内容为null时表示"不存在"，编码为"$-1\r\n"。
 * 负载是二进制安全的，基于 {@link RedisBytes} 保存。
 *
 * <p>使用建议：
 * <ul>
 *     <li>解码器等内部路径使用wrapTrusted避免拷贝</li>
 *     <li>外部数据使用create确保安全性</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BulkString extends Resp {
    /** 空值的RESP编码 */
    public static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    /** 空字符串的RESP编码 */
    public static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    /** 预定义的null批量字符串 */
    public static final BulkString NULL = new BulkString((RedisBytes) null);

    /** 字符串内容，null表示不存在 */
    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    /**
     * 安全模式工厂方法，会复制输入数组
     *
     * @param content 字节数组内容
     * @return BulkString实例
     */
    public static BulkString create(final byte[] content) {
        if (content == null) {
            return NULL;
        }
        return new BulkString(new RedisBytes(content));
    }

    /**
     * 基于已有RedisBytes创建
     *
     * @param content RedisBytes内容，null时返回NULL
     * @return BulkString实例
     */
    public static BulkString create(final RedisBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    /**
     * 零拷贝工厂方法，调用者必须保证数组不会再被修改
     *
     * @param trustedBytes 受信任的字节数组
     * @return 零拷贝的BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.fromString(str));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }

        final byte[] bytes = content.getBytesUnsafe();
        final int length = bytes.length;

        if (length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        byteBuf.ensureWritable(estimateEncodedSize(length));

        // 1. 写入标识符和长度
        byteBuf.writeByte('$');
        writeIntegerAsBytes(byteBuf, length);
        byteBuf.writeBytes(CRLF);

        // 2. 写入内容和结束分隔符
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * 估算编码后的大小，用于 ByteBuf 预分配
     *
     * @param contentLength 内容长度
     * @return 估算的编码大小
     */
    static int estimateEncodedSize(final int contentLength) {
        final int digitLength = contentLength < 10 ? 1
                : contentLength < 100 ? 2
                : contentLength < 1000 ? 3
                : String.valueOf(contentLength).length();

        // '$' + 长度数字 + '\r\n' + 内容 + '\r\n'
        return 1 + digitLength + 2 + contentLength + 2;
    }

    @Override
    public String toString() {
        return content != null ? content.getString() : "(nil)";
    }
}
