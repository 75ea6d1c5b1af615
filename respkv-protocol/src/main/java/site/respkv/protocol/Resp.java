package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * RESP协议值的基础类
 *
 * <p>所有 RESP 数据类型（简单字符串、错误、整数、批量字符串、数组）的公共父类，
 * 定义统一的编码接口，并提供数字写入等共享工具方法。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头</li>
 *     <li>数组 - 以"*"开头</li>
 * </ul>
 *
 * <p>子类均为不可变值对象，按内容实现 equals/hashCode。
 *
 * @author respkv
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    /** 数字的字节表示缓存，下标 0..255 为非负数，256..511 为负数 */
    protected static final byte[][] NUMBERS = new byte[512][];

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 以十进制ASCII写入整数，小数值走缓存
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeIntegerAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 从缓冲区当前读位置解码一个完整的 RESP 元素
     *
     * @param buffer 输入缓冲区，读指针即游标
     * @return 解码后的值，缓冲区已无可读数据时返回null
     * @throws MalformedFrameException 数据格式不符合RESP规范
     * @throws IncompleteFrameException 元素在缓冲区末尾之前未结束
     */
    public static Resp decode(final ByteBuf buffer) {
        return new RespParser(buffer).parse();
    }

    /**
     * 将当前值编码写入缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 编码为独立的字节数组，便于测试与日志
     *
     * @return RESP线格式字节
     */
    public byte[] toBytes() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            encode(buf);
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }
}
