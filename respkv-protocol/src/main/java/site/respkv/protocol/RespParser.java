package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;
import site.respkv.datastructure.RedisBytes;

import java.nio.charset.CharacterCodingException;

/**
 * RESP 协议解析器
 *
 * <p>以 ByteBuf 的读指针作为游标，每次 {@link #parse()} 消费一个完整元素。
 * 解析器本身不做跨读取的缓冲，也不回滚游标：出错时游标停在出错位置，
 * 由调用方（如 {@link site.respkv.protocol.handler.RespDecoder}）负责标记与回退。
 *
 * <p>错误分类：
 * <ul>
 *     <li>{@link IncompleteFrameException} - 数据在元素结束前耗尽，流式读取方应等待更多字节</li>
 *     <li>{@link MalformedFrameException} - 格式错误，不可恢复</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespParser {

    /** 批量字符串最大长度 512MB */
    static final long PROTO_MAX_BULK_LEN = 512L * 1024 * 1024;

    /** 数组最大元素数 */
    static final long PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    /** 数组最大嵌套层数 */
    static final int PROTO_MAX_NESTING = 32;

    private final ByteBuf buffer;

    public RespParser(final ByteBuf buffer) {
        this.buffer = buffer;
    }

    /**
     * 解析一个 RESP 元素
     *
     * @return 解析结果；游标已在缓冲区末尾时返回null
     * @throws MalformedFrameException 遇到未知类型标识或格式错误
     * @throws IncompleteFrameException 元素不完整
     */
    public Resp parse() {
        return parse(0);
    }

    private Resp parse(final int depth) {
        if (!buffer.isReadable()) {
            return null;
        }

        final byte prefix = buffer.readByte();
        switch (prefix) {
            case '*':
                return parseArray(depth);
            case '$':
                return parseBulkString();
            case '+':
                return new SimpleString(readText("simple string"));
            case '-':
                return new Errors(readText("error"));
            case ':':
                return RespInteger.valueOf(readNumber());
            default:
                log.warn("无法识别的RESP类型标识: '{}' (字节值: {})", (char) prefix, prefix & 0xFF);
                throw new MalformedFrameException("Unknown RESP prefix: " + describe(prefix));
        }
    }

    /**
     * 读取一行，不含结束符 \r\n
     *
     * @return 游标与结束符之间的字节
     * @throws IncompleteFrameException 缓冲区末尾之前没有找到 \r\n
     */
    public byte[] readLine() {
        final int start = buffer.readerIndex();
        final int end = indexOfCrlf(start);
        if (end < 0) {
            throw new IncompleteFrameException("Incomplete line in RESP data");
        }
        final byte[] line = new byte[end - start];
        buffer.readBytes(line);
        buffer.skipBytes(CRLF_LENGTH);
        return line;
    }

    private static final int CRLF_LENGTH = 2;

    private int indexOfCrlf(final int from) {
        final int limit = buffer.writerIndex();
        int index = from;
        while (index < limit) {
            final int cr = buffer.indexOf(index, limit, (byte) '\r');
            if (cr < 0 || cr + 1 >= limit) {
                return -1;
            }
            if (buffer.getByte(cr + 1) == '\n') {
                return cr;
            }
            // 孤立的\r属于行内容
            index = cr + 1;
        }
        return -1;
    }

    private Resp parseArray(final int depth) {
        if (depth >= PROTO_MAX_NESTING) {
            throw new MalformedFrameException("Array nesting exceeds limit " + PROTO_MAX_NESTING);
        }
        final long length = readNumber();
        if (length < 0) {
            return RespArray.NULL;
        }
        if (length > PROTO_MAX_ARRAY_LEN) {
            throw new MalformedFrameException("Array length " + length + " exceeds limit " + PROTO_MAX_ARRAY_LEN);
        }
        if (length == 0) {
            return RespArray.EMPTY;
        }

        final Resp[] elements = new Resp[(int) length];
        for (int i = 0; i < length; i++) {
            final Resp element = parse(depth + 1);
            if (element == null) {
                throw new IncompleteFrameException("Incomplete array element " + i + " of " + length);
            }
            elements[i] = element;
        }
        return new RespArray(elements);
    }

    private Resp parseBulkString() {
        final long length = readNumber();
        if (length < 0) {
            return BulkString.NULL;
        }
        if (length > PROTO_MAX_BULK_LEN) {
            throw new MalformedFrameException("Bulk string length " + length + " exceeds limit " + PROTO_MAX_BULK_LEN);
        }
        if (buffer.readableBytes() < length + CRLF_LENGTH) {
            throw new IncompleteFrameException("Incomplete bulk string");
        }

        final byte[] content = new byte[(int) length];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new MalformedFrameException("Bulk string is not terminated by CRLF");
        }
        return BulkString.wrapTrusted(content);
    }

    private String readText(final String kind) {
        final byte[] line = readLine();
        try {
            return RedisBytes.decodeStrict(line, 0, line.length);
        } catch (CharacterCodingException e) {
            throw new MalformedFrameException("Invalid UTF-8 in " + kind, e);
        }
    }

    /**
     * 读取一行并按十进制有符号64位整数解析
     */
    private long readNumber() {
        final byte[] line = readLine();
        if (line.length == 0) {
            throw new MalformedFrameException("Empty numeric line");
        }

        final boolean negative = line[0] == '-';
        final int start = negative ? 1 : 0;
        if (start == line.length) {
            throw new MalformedFrameException("Numeric line contains only a sign");
        }

        long value = 0;
        try {
            for (int i = start; i < line.length; i++) {
                final byte b = line[i];
                if (b < '0' || b > '9') {
                    throw new MalformedFrameException("Non-numeric content: " + describe(line));
                }
                // 按负数累加，Long.MIN_VALUE 也能表示
                value = Math.subtractExact(Math.multiplyExact(value, 10), b - '0');
            }
            return negative ? value : Math.negateExact(value);
        } catch (ArithmeticException e) {
            throw new MalformedFrameException("Integer out of range: " + describe(line), e);
        }
    }

    private static String describe(final byte prefix) {
        return prefix >= 32 && prefix <= 126
                ? "'" + (char) prefix + "'"
                : String.format("0x%02x", prefix & 0xFF);
    }

    private static String describe(final byte[] line) {
        return new RedisBytes(line).getString();
    }
}
