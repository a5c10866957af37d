package site.tinyredis.server;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 连接准入闸门，异步的计数信号量
 *
 * <p>{@link #acquire(EventExecutor)}不阻塞线程，许可不足时返回未完成的future，
 * 有许可归还时按申请顺序完成。每个{@link Permit}只归还一次。
 */
public class AdmissionGate {

    private final int maxPermits;

    private int available;

    private final Deque<Promise<Permit>> waiters = new ArrayDeque<>();

    public AdmissionGate(final int maxPermits) {
        if (maxPermits <= 0) {
            throw new IllegalArgumentException("许可数必须大于0");
        }
        this.maxPermits = maxPermits;
        this.available = maxPermits;
    }

    /**
     * 申请一个许可
     *
     * @param executor 完成future并通知监听器的执行器
     * @return 获得许可后完成的future；取消future即放弃申请
     */
    public Future<Permit> acquire(final EventExecutor executor) {
        final Promise<Permit> promise = executor.newPromise();
        final boolean granted;
        synchronized (this) {
            granted = available > 0;
            if (granted) {
                available--;
            } else {
                waiters.addLast(promise);
            }
        }
        if (granted) {
            promise.setSuccess(new Permit());
        }
        return promise;
    }

    public synchronized int availablePermits() {
        return available;
    }

    public synchronized int waiting() {
        return waiters.size();
    }

    public int maxPermits() {
        return maxPermits;
    }

    private void release() {
        for (;;) {
            final Promise<Permit> next;
            synchronized (this) {
                next = waiters.pollFirst();
                if (next == null) {
                    if (available >= maxPermits) {
                        throw new IllegalStateException("归还的许可多于发放的许可");
                    }
                    available++;
                    return;
                }
            }
            // 等待者可能已取消申请，此时交给下一个
            if (next.trySuccess(new Permit())) {
                return;
            }
        }
    }

    /**
     * 一个已获得的许可，关闭即归还
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
