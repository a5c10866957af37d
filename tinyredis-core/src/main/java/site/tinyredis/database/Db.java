package site.tinyredis.database;

import lombok.extern.slf4j.Slf4j;
import site.tinyredis.pubsub.Broadcast;
import site.tinyredis.pubsub.Message;
import site.tinyredis.pubsub.MessageListener;
import site.tinyredis.pubsub.Subscription;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 服务器共享的内存数据库
 *
 * <p>所有连接共享同一个实例，内部状态包括：
 * <ul>
 *     <li>键值表 - 键到{@link Entry}的映射，条目带有单调递增的id和可选的过期时间</li>
 *     <li>过期索引 - 按(过期时间, id)排序的有序表，O(log n)取得最近一个过期的键</li>
 *     <li>发布订阅注册表 - 频道名到{@link Broadcast}的映射，没有订阅者的频道不保留</li>
 * </ul>
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li>全部状态由一把互斥锁保护，键值表与过期索引始终在同一临界区内修改，二者保持一一对应</li>
 *     <li>锁只覆盖内存中的表操作，不跨越任何I/O；消息投递与唤醒信号均在释放锁之后进行</li>
 * </ul>
 *
 * <h2>过期清理：</h2>
 * <p>构造时启动一个后台清理线程，删除已过期的键后休眠到下一个过期时间，
 * 或在插入了更早的过期时间时被提前唤醒。读取不检查过期时间，
 * 已过期但尚未被清理的键在下一轮清理之前仍然可读。
 *
 * <p>实例由{@link DbDropGuard}持有，关闭守卫时清理线程退出。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class Db {

    private static final AtomicInteger PURGE_THREAD_SEQ = new AtomicInteger();

    /** 保护全部状态的互斥锁 */
    private final ReentrantLock lock = new ReentrantLock();

    /** 受锁保护的状态 */
    private final State state = new State();

    /** 清理线程的唤醒信号，最多积累的许可在每轮被清空 */
    private final Semaphore backgroundTask = new Semaphore(0);

    /** 过期时间的时间基准 */
    private final long originNanos = System.nanoTime();

    private final Thread purgeThread;

    Db() {
        this.purgeThread = new Thread(this::purgeExpiredTasks, "tinyredis-purge-" + PURGE_THREAD_SEQ.incrementAndGet());
        this.purgeThread.setDaemon(true);
        this.purgeThread.start();
    }

    /**
     * 获取键对应的值
     *
     * @param key 键
     * @return 值的副本，键不存在时返回null
     */
    public byte[] get(final String key) {
        lock.lock();
        try {
            final Entry entry = state.entries.get(key);
            return entry == null ? null : entry.data.clone();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 设置键值，覆盖已有的值与过期时间
     *
     * @param key 键
     * @param value 值，会被复制
     * @param expire 存活时间，null表示永不过期
     */
    public void set(final String key, final byte[] value, final Duration expire) {
        boolean notify = false;

        lock.lock();
        try {
            final long id = state.nextId++;

            Long expiresAt = null;
            if (expire != null) {
                final long when = now() + expire.toNanos();
                // 只有新的过期时间成为最近的一个时，清理线程才需要重新计算休眠时间
                final Long next = state.nextExpiration();
                notify = next == null || next > when;
                state.expirations.put(new ExpirationKey(when, id), key);
                expiresAt = when;
            }

            final Entry prev = state.entries.put(key, new Entry(id, value.clone(), expiresAt));
            if (prev != null && prev.expiresAt != null) {
                final String tracked = state.expirations.remove(new ExpirationKey(prev.expiresAt, prev.id));
                if (tracked == null) {
                    throw new IllegalStateException("过期索引缺少键 " + key + " 的记录 (id=" + prev.id + ")");
                }
            }
        } finally {
            lock.unlock();
        }

        if (notify) {
            backgroundTask.release();
        }
    }

    /**
     * 订阅频道
     *
     * @param channel 频道名
     * @param listener 消息回调，在发布者线程上执行
     * @return 订阅句柄，关闭即退订
     */
    public Subscription subscribe(final String channel, final MessageListener listener) {
        final Subscription subscription = new Subscription(channel, listener, this::unsubscribe);
        lock.lock();
        try {
            state.pubSub.computeIfAbsent(channel, Broadcast::new).add(subscription);
        } finally {
            lock.unlock();
        }
        return subscription;
    }

    private void unsubscribe(final Subscription subscription) {
        lock.lock();
        try {
            final Broadcast broadcast = state.pubSub.get(subscription.getChannel());
            if (broadcast != null && broadcast.remove(subscription)) {
                state.pubSub.remove(subscription.getChannel());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 向频道发布消息
     *
     * @param channel 频道名
     * @param payload 消息内容
     * @return 接收到消息的订阅者数量，频道无人订阅时为0
     */
    public int publish(final String channel, final byte[] payload) {
        final Subscription[] receivers;
        lock.lock();
        try {
            final Broadcast broadcast = state.pubSub.get(channel);
            if (broadcast == null) {
                return 0;
            }
            receivers = broadcast.snapshot();
        } finally {
            lock.unlock();
        }

        final Message message = new Message(channel, payload.clone());
        for (final Subscription receiver : receivers) {
            receiver.deliver(message);
        }
        return receivers.length;
    }

    /**
     * @return 当前键的数量
     */
    public int size() {
        lock.lock();
        try {
            return state.entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 当前有订阅者的频道数量
     */
    public int channelCount() {
        lock.lock();
        try {
            return state.pubSub.size();
        } finally {
            lock.unlock();
        }
    }

    Thread getPurgeThread() {
        return purgeThread;
    }

    /**
     * 通知清理线程退出，由{@link DbDropGuard#close()}调用
     */
    void shutdownPurgeTask() {
        lock.lock();
        try {
            state.shutdown = true;
        } finally {
            lock.unlock();
        }
        // 释放锁之后再唤醒，避免清理线程醒来后立即阻塞在锁上
        backgroundTask.release();
    }

    private long now() {
        return System.nanoTime() - originNanos;
    }

    private boolean isShutdown() {
        lock.lock();
        try {
            return state.shutdown;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清理线程主循环：删除过期键，然后休眠到下一个过期时间或被唤醒
     */
    private void purgeExpiredTasks() {
        try {
            while (!isShutdown()) {
                final Long when = purgeExpiredKeys();
                if (when != null) {
                    final long waitNanos = when - now();
                    if (waitNanos > 0) {
                        backgroundTask.tryAcquire(waitNanos, TimeUnit.NANOSECONDS);
                    }
                } else {
                    backgroundTask.acquire();
                }
                // 醒来后总是重新读取状态，多余的唤醒信号一并丢弃
                backgroundTask.drainPermits();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("过期清理线程被中断");
            return;
        }
        log.debug("Purge background task shut down");
    }

    /**
     * 删除全部已过期的键
     *
     * @return 下一个键的过期时间，没有待过期的键或已关闭时返回null
     */
    Long purgeExpiredKeys() {
        lock.lock();
        try {
            if (state.shutdown) {
                return null;
            }
            final long now = now();
            while (!state.expirations.isEmpty()) {
                final Map.Entry<ExpirationKey, String> first = state.expirations.firstEntry();
                final ExpirationKey expiration = first.getKey();
                if (expiration.when > now) {
                    return expiration.when;
                }
                final String key = first.getValue();
                final Entry removed = state.entries.remove(key);
                if (removed == null || removed.id != expiration.id) {
                    throw new IllegalStateException("键值表与过期索引不一致: key=" + key + ", id=" + expiration.id);
                }
                state.expirations.pollFirstEntry();
                log.debug("键已过期并被清理: {}", key);
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 受锁保护的数据库状态
     */
    private static final class State {
        private final Map<String, Entry> entries = new HashMap<>();

        private final Map<String, Broadcast> pubSub = new HashMap<>();

        private final TreeMap<ExpirationKey, String> expirations = new TreeMap<>();

        private long nextId;

        private boolean shutdown;

        private Long nextExpiration() {
            return expirations.isEmpty() ? null : expirations.firstKey().when;
        }
    }

    /**
     * 键值表中的一个条目
     */
    private static final class Entry {
        /** 唯一id，用于定位过期索引中的记录 */
        private final long id;

        private final byte[] data;

        /** 过期时间（相对originNanos的纳秒数），null表示永不过期 */
        private final Long expiresAt;

        private Entry(final long id, final byte[] data, final Long expiresAt) {
            this.id = id;
            this.data = data;
            this.expiresAt = expiresAt;
        }
    }

    /**
     * 过期索引的键，先按时间再按id排序，相同时间的两个键不会冲突
     */
    private static final class ExpirationKey implements Comparable<ExpirationKey> {
        private final long when;

        private final long id;

        private ExpirationKey(final long when, final long id) {
            this.when = when;
            this.id = id;
        }

        @Override
        public int compareTo(final ExpirationKey other) {
            final int byTime = Long.compare(when, other.when);
            return byTime != 0 ? byTime : Long.compare(id, other.id);
        }

        @Override
        public boolean equals(final Object o) {
            if (!(o instanceof ExpirationKey)) {
                return false;
            }
            final ExpirationKey that = (ExpirationKey) o;
            return when == that.when && id == that.id;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(when) * 31 + Long.hashCode(id);
        }
    }
}
