package site.respkv.datastructure;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 键空间中的一个条目：值与可选的绝对过期时间
 *
 * <p>过期时间以毫秒时间戳表示，-1表示永不过期。条目是不可变的，
 * 覆盖写入时整体替换，因此不带TTL的SET会自然清除旧的过期时间。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StoreEntry {

    /** 永不过期 */
    public static final long NO_EXPIRE = -1L;

    private final RedisBytes value;

    /** 过期时间戳（毫秒），-1表示永不过期 */
    private final long expireAt;

    public StoreEntry(final RedisBytes value, final long expireAt) {
        if (value == null) {
            throw new IllegalArgumentException("value不能为null");
        }
        this.value = value;
        this.expireAt = expireAt;
    }

    public static StoreEntry persistent(final RedisBytes value) {
        return new StoreEntry(value, NO_EXPIRE);
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    /**
     * 判断在给定时刻是否已过期，到达过期时间的那一毫秒即视为过期
     *
     * @param nowMillis 当前时间戳（毫秒）
     * @return 已过期返回true
     */
    public boolean isExpired(final long nowMillis) {
        return expireAt != NO_EXPIRE && nowMillis >= expireAt;
    }
}
