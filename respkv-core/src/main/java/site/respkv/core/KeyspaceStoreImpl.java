package site.respkv.core;

import lombok.extern.slf4j.Slf4j;
import site.respkv.database.Keyspace;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.StoreEntry;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 键值存储实现类
 *
 * <p>在 {@link Keyspace} 之上负责时间与后台任务：
 * <ul>
 *     <li>从注入的 {@link Clock} 读取当前时间（默认 {@link MonotonicClock}），惰性过期与定期过期使用同一个时钟</li>
 *     <li>把相对TTL换算成绝对过期时间戳</li>
 *     <li>管理单线程的定时清理任务</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class KeyspaceStoreImpl implements KeyspaceStore {

    private static final String SWEEPER_THREAD_NAME = "respkv-expire-sweeper";

    private final Keyspace keyspace;

    private final Clock clock;

    /** 定时清理执行器，未启动时为null */
    private ScheduledExecutorService sweeper;

    private boolean shutdown;

    public KeyspaceStoreImpl() {
        this(new MonotonicClock());
    }

    public KeyspaceStoreImpl(final Clock clock) {
        this(new Keyspace(), clock);
    }

    KeyspaceStoreImpl(final Keyspace keyspace, final Clock clock) {
        this.keyspace = keyspace;
        this.clock = clock;
    }

    private long now() {
        return clock.millis();
    }

    @Override
    public void set(final String key, final RedisBytes value) {
        keyspace.put(key, StoreEntry.persistent(value));
    }

    @Override
    public void set(final String key, final RedisBytes value, final Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl必须为正数: " + ttl);
        }
        final long expireAt;
        try {
            // Duration.toMillis 对超大值同样抛出 ArithmeticException
            expireAt = Math.addExact(now(), ttl.toMillis());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("ttl超出范围: " + ttl, e);
        }
        keyspace.put(key, new StoreEntry(value, expireAt));
    }

    @Override
    public RedisBytes get(final String key) {
        return keyspace.get(key, now());
    }

    @Override
    public boolean delete(final String key) {
        return keyspace.remove(key, now());
    }

    @Override
    public boolean exists(final String key) {
        return keyspace.containsLive(key, now());
    }

    @Override
    public int sweepExpired() {
        final int removed = keyspace.removeExpired(now());
        if (removed > 0) {
            log.debug("过期清理完成，删除 {} 个键", removed);
        }
        return removed;
    }

    @Override
    public int size() {
        return keyspace.size();
    }

    @Override
    public synchronized void startExpirySweeper(final Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("清理间隔必须为正数: " + interval);
        }
        if (shutdown) {
            throw new IllegalStateException("存储已关闭");
        }
        if (sweeper != null) {
            throw new IllegalStateException("过期清理任务已启动");
        }

        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, SWEEPER_THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        final long intervalMs = interval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("过期清理任务已启动，间隔 {}ms", intervalMs);
    }

    /**
     * 定时任务中抛出的异常会取消后续调度，这里记录后继续
     */
    private void sweepSafely() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            log.error("过期清理失败", e);
        }
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
        if (sweeper == null) {
            return;
        }
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
        sweeper = null;
        log.info("过期清理任务已停止");
    }
}
