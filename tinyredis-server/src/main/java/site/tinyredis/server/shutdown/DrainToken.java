package site.tinyredis.server.shutdown;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 排空令牌，每个连接持有一个，关闭时归还
 *
 * <p>重复关闭只归还一次。
 */
public final class DrainToken implements AutoCloseable {

    private final DrainTracker tracker;

    private final AtomicBoolean released = new AtomicBoolean();

    DrainToken(final DrainTracker tracker) {
        this.tracker = tracker;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            tracker.release();
        }
    }
}
