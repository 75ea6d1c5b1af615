package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Redis整数类型
 *
 * <p>格式：":1000\r\n"，取值范围为有符号64位整数。
 * 基于享元模式，-10到127之间的值使用缓存实例。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class RespInteger extends Resp {
    /** 缓存范围下限 */
    private static final int CACHE_LOW = -10;

    /** 缓存范围上限 */
    private static final int CACHE_HIGH = 127;

    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i + CACHE_LOW);
        }
    }

    public static final RespInteger ZERO = CACHE[-CACHE_LOW];
    public static final RespInteger ONE = CACHE[1 - CACHE_LOW];

    /** 整数值 */
    private final long content;

    private RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法：缓存范围内返回共享实例
     *
     * @param value 整数值
     * @return RespInteger 实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeIntegerAsBytes(byteBuf, content);
        byteBuf.writeBytes(CRLF);
    }
}
