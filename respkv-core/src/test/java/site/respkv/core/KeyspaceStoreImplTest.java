package site.respkv.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import site.respkv.datastructure.RedisBytes;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KeyspaceStoreImpl 单元测试
 *
 * 测试覆盖：
 * 1. 基本读写与不存在的键
 * 2. TTL 过期（get 与 exists）
 * 3. 覆盖写入清除过期时间
 * 4. 删除语义
 * 5. 后台清理任务
 */
@DisplayName("KeyspaceStoreImpl 单元测试")
class KeyspaceStoreImplTest {

    private static final RedisBytes V1 = RedisBytes.fromString("v1");
    private static final RedisBytes V2 = RedisBytes.fromString("v2");

    private MutableClock clock;
    private KeyspaceStoreImpl store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        store = new KeyspaceStoreImpl(clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Nested
    @DisplayName("基本读写")
    class BasicTests {

        @Test
        @DisplayName("从未写入的键不存在")
        void testAbsentKey() {
            assertNull(store.get("missing"));
            assertFalse(store.exists("missing"));
            assertFalse(store.delete("missing"));
        }

        @Test
        @DisplayName("不带TTL的键不会自行过期")
        void testNoImplicitExpiry() {
            store.set("k", V1);
            clock.advance(Duration.ofDays(3650));

            assertEquals(V1, store.get("k"));
            assertTrue(store.exists("k"));
        }

        @Test
        @DisplayName("覆盖写入返回新值")
        void testOverwrite() {
            store.set("k", V1);
            store.set("k", V2);

            assertEquals(V2, store.get("k"));
            assertEquals(1, store.size());
        }
    }

    @Nested
    @DisplayName("过期时间")
    class TtlTests {

        @Test
        @DisplayName("到期后get与exists都视为不存在")
        void testExpiry() {
            store.set("k", V1, Duration.ofMillis(100));

            clock.advance(Duration.ofMillis(99));
            assertEquals(V1, store.get("k"));
            assertTrue(store.exists("k"));

            clock.advance(Duration.ofMillis(1));
            assertFalse(store.exists("k"));
            assertNull(store.get("k"));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("不带TTL的覆盖写入清除旧的过期时间")
        void testOverwriteClearsTtl() {
            store.set("k", V1, Duration.ofSeconds(1));
            store.set("k", V2);

            clock.advance(Duration.ofSeconds(10));
            assertEquals(V2, store.get("k"));
        }

        @Test
        @DisplayName("非正数的TTL被拒绝")
        void testInvalidTtl() {
            assertThrows(IllegalArgumentException.class, () -> store.set("k", V1, Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> store.set("k", V1, Duration.ofMillis(-1)));
            assertThrows(IllegalArgumentException.class, () -> store.set("k", V1, null));
            assertThrows(IllegalArgumentException.class,
                    () -> store.set("k", V1, Duration.ofMillis(Long.MAX_VALUE)));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("删除已过期的键返回false")
        void testDeleteExpired() {
            store.set("k", V1, Duration.ofMillis(10));
            clock.advance(Duration.ofMillis(20));

            assertFalse(store.delete("k"));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("删除后键不存在")
        void testDelete() {
            store.set("k", V1);

            assertTrue(store.delete("k"));
            assertFalse(store.exists("k"));
            assertNull(store.get("k"));
        }
    }

    @Nested
    @DisplayName("过期清理")
    class SweepTests {

        @Test
        @DisplayName("清理回收从未再读取的过期键")
        void testSweepExpired() {
            store.set("a", V1, Duration.ofMillis(10));
            store.set("b", V1, Duration.ofMillis(10));
            store.set("c", V1);
            clock.advance(Duration.ofMillis(10));

            assertEquals(3, store.size());
            assertEquals(2, store.sweepExpired());
            assertEquals(1, store.size());
            assertEquals(0, store.sweepExpired());
        }

        @Test
        @DisplayName("后台任务定期清理")
        void testBackgroundSweeper() throws InterruptedException {
            store.set("a", V1, Duration.ofMillis(10));
            clock.advance(Duration.ofMillis(10));

            store.startExpirySweeper(Duration.ofMillis(20));

            final long deadline = System.currentTimeMillis() + 5000;
            while (store.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("重复启动或关闭后启动抛出异常")
        void testSweeperLifecycle() {
            store.startExpirySweeper(Duration.ofSeconds(60));
            assertThrows(IllegalStateException.class, () -> store.startExpirySweeper(Duration.ofSeconds(60)));

            store.shutdown();
            assertThrows(IllegalStateException.class, () -> store.startExpirySweeper(Duration.ofSeconds(60)));
            assertThrows(IllegalArgumentException.class, () -> store.startExpirySweeper(Duration.ZERO));
        }
    }

    @Test
    @DisplayName("并发读写同一个键")
    void testConcurrentSameKey() throws InterruptedException {
        final int threadCount = 8;
        final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        final CountDownLatch latch = new CountDownLatch(threadCount);
        final AtomicInteger deleted = new AtomicInteger();
        store.set("shared", V1);

        for (int t = 0; t < threadCount; t++) {
            executor.submit(() -> {
                try {
                    if (store.delete("shared")) {
                        deleted.incrementAndGet();
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(1, deleted.get());
    }
}
