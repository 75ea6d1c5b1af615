package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * Redis数组类型
 *
 * <p>格式："*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"。客户端请求总是以批量字符串数组的形式发送，
 * 服务端当前的命令集不会以数组作为响应，但编码器对称地支持它。
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class RespArray extends Resp {
    /** null数组的RESP编码 */
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();

    /** 空数组的RESP编码 */
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 预定义的null数组实例 */
    public static final RespArray NULL = new RespArray((Resp[]) null);

    /** 数组内容，null表示null数组 */
    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }


    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        byteBuf.ensureWritable(estimateEncodedSize(content));
        byteBuf.writeByte('*');
        writeIntegerAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);

        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    /**
     * 估算编码后的大小，用于 ByteBuf 预分配
     *
     * @param arrayContent 数组内容
     * @return 估算的编码大小（字节数）
     */
    private static int estimateEncodedSize(final Resp[] arrayContent) {
        // '*' + 数组长度 + '\r\n'
        int totalSize = 1 + String.valueOf(arrayContent.length).length() + 2;

        for (final Resp element : arrayContent) {
            if (element instanceof BulkString && !((BulkString) element).isNull()) {
                totalSize += BulkString.estimateEncodedSize(((BulkString) element).getContent().length());
            } else {
                totalSize += 16;
            }
        }
        return totalSize;
    }

    @Override
    public String toString() {
        return content == null ? "RespArray[null]" : "RespArray" + Arrays.toString(content);
    }
}
