package site.respkv.core;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 单调时钟
 *
 * <p>创建时记录一次墙上时间作为起点，之后只按 {@link System#nanoTime()} 的流逝推进。
 * 系统时间被NTP或手动调整时，已设置的TTL不受影响。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class MonotonicClock extends Clock {

    private final long originMillis;

    private final long originNanos;

    public MonotonicClock() {
        this.originMillis = System.currentTimeMillis();
        this.originNanos = System.nanoTime();
    }

    @Override
    public long millis() {
        return originMillis + (System.nanoTime() - originNanos) / 1_000_000L;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
        return this;
    }
}
