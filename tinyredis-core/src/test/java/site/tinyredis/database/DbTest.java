package site.tinyredis.database;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Db单元测试
 *
 * <p>覆盖键值读写、TTL过期清理、覆盖写对过期记录的回收、清理线程的唤醒与退出。
 */
@DisplayName("Db单元测试")
class DbTest {

    private DbDropGuard guard;
    private Db db;

    @BeforeEach
    void setUp() {
        guard = new DbDropGuard();
        db = guard.db();
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("未设置过的键不存在")
    void testGetMissingKey() {
        assertNull(db.get("missing"));
        assertEquals(0, db.size());
    }

    @Test
    @DisplayName("无TTL的键一直可读")
    void testSetWithoutTtl() throws Exception {
        db.set("hello", bytes("world"), null);

        Thread.sleep(50);
        assertArrayEquals(bytes("world"), db.get("hello"));
        assertNull(db.purgeExpiredKeys());
    }

    @Test
    @DisplayName("读写都复制数据，外部修改不影响存储")
    void testValueIsCopied() {
        byte[] value = bytes("abc");
        db.set("k", value, null);
        value[0] = 'x';

        byte[] read = db.get("k");
        read[1] = 'y';

        assertArrayEquals(bytes("abc"), db.get("k"));
    }

    @Test
    @DisplayName("TTL到期前可读，到期后被后台清理")
    void testExpiration() {
        db.set("hello", bytes("world"), Duration.ofMillis(200));

        assertArrayEquals(bytes("world"), db.get("hello"));
        await().atMost(Duration.ofSeconds(3)).until(() -> db.get("hello") == null);
        assertEquals(0, db.size());
    }

    @Test
    @DisplayName("覆盖写去掉TTL后，原过期时间不再淘汰该键")
    void testOverwriteRetiresOldExpiration() throws Exception {
        db.set("k", bytes("v1"), Duration.ofMillis(150));
        db.set("k", bytes("v2"), null);

        Thread.sleep(400);
        assertArrayEquals(bytes("v2"), db.get("k"));
        assertNull(db.purgeExpiredKeys());
    }

    @Test
    @DisplayName("覆盖写延长TTL后按新的过期时间淘汰")
    void testOverwriteWithLaterTtl() throws Exception {
        db.set("k", bytes("v1"), Duration.ofMillis(100));
        db.set("k", bytes("v2"), Duration.ofSeconds(30));

        Thread.sleep(300);
        assertArrayEquals(bytes("v2"), db.get("k"));
        assertNotNull(db.purgeExpiredKeys());
    }

    @Test
    @DisplayName("更早的过期时间会唤醒正在长时间休眠的清理线程")
    void testEarlierExpirationWakesPurgeTask() {
        db.set("late", bytes("1"), Duration.ofHours(1));
        db.set("soon", bytes("2"), Duration.ofMillis(100));

        await().atMost(Duration.ofSeconds(3)).until(() -> db.get("soon") == null);
        assertArrayEquals(bytes("1"), db.get("late"));
    }

    @Test
    @DisplayName("相同过期时间的多个键互不冲突")
    void testManyKeysExpire() {
        for (int i = 0; i < 100; i++) {
            db.set("key-" + i, bytes("v" + i), Duration.ofMillis(100 + (i % 3)));
        }
        db.set("keep", bytes("v"), null);

        await().atMost(Duration.ofSeconds(3)).until(() -> db.size() == 1);
        assertNotNull(db.get("keep"));
    }

    @Test
    @DisplayName("关闭守卫后清理线程退出，重复关闭安全")
    void testShutdownStopsPurgeTask() throws Exception {
        db.set("k", bytes("v"), Duration.ofHours(1));
        assertTrue(db.getPurgeThread().isAlive());

        guard.close();
        guard.close();

        db.getPurgeThread().join(TimeUnit.SECONDS.toMillis(3));
        assertFalse(db.getPurgeThread().isAlive());
        assertNull(db.purgeExpiredKeys());
    }

    @Test
    @DisplayName("并发写入不同键")
    void testConcurrentWrites() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                final int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        Duration ttl = i % 2 == 0 ? Duration.ofMinutes(5) : null;
                        db.set("t" + thread + "-" + i, bytes("v"), ttl);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, db.size());
    }
}
