package site.tinyredis.server.shutdown;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 未归还令牌的引用计数
 *
 * <p>计数从1开始，这一份属于协调者自己。所有令牌（包括协调者的）归还后计数降为0，
 * {@link #drained()}完成，此后不能再发放新令牌。
 */
@Slf4j
public class DrainTracker {

    private final AtomicInteger outstanding = new AtomicInteger(1);

    private final Promise<Void> drained = GlobalEventExecutor.INSTANCE.newPromise();

    private final DrainToken ownerToken = new DrainToken(this);

    /**
     * 为一个新连接发放令牌
     *
     * @return 新令牌
     * @throws IllegalStateException 已经排空
     */
    public DrainToken acquire() {
        for (;;) {
            final int current = outstanding.get();
            if (current == 0) {
                throw new IllegalStateException("所有令牌已归还，不能再发放");
            }
            if (outstanding.compareAndSet(current, current + 1)) {
                return new DrainToken(this);
            }
        }
    }

    /**
     * 归还协调者自己持有的令牌，重复调用无效果
     */
    public void releaseOwner() {
        ownerToken.close();
    }

    void release() {
        final int remaining = outstanding.decrementAndGet();
        if (remaining < 0) {
            throw new IllegalStateException("令牌归还次数多于发放次数");
        }
        if (remaining == 0) {
            log.debug("所有连接已退出");
            drained.trySuccess(null);
        }
    }

    public int outstanding() {
        return outstanding.get();
    }

    /**
     * 连接持有的令牌数，不含协调者自己的一份
     */
    public int connectionTokens() {
        final int current = outstanding.get();
        return ownerToken.isReleased() ? current : current - 1;
    }

    public Future<Void> drained() {
        return drained;
    }
}
