package site.tinyredis.server.shutdown;

import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * 关闭协调者
 *
 * <p>持有一个关闭广播和一个排空计数：
 * <ul>
 *   <li>每个连接建立时领取一个{@link DrainToken}，连接关闭时归还
 *   <li>连接处理器监听{@link ShutdownSignal}，收到后停止读取并关闭连接
 *   <li>{@link #initiate()}触发广播并归还协调者自己的令牌，返回的future在最后一个连接退出后完成
 * </ul>
 *
 * <p>协调者不记录具体有哪些连接，只知道还有多少没有退出。
 */
@Slf4j
public class ShutdownCoordinator {

    private final ShutdownSignal signal = new ShutdownSignal();

    private final DrainTracker tracker = new DrainTracker();

    public ShutdownSignal signal() {
        return signal;
    }

    /**
     * 为一个新连接领取排空令牌
     *
     * @throws IllegalStateException 已经排空
     */
    public DrainToken enlist() {
        return tracker.acquire();
    }

    /**
     * 开始关闭，重复调用返回同一个future
     *
     * @return 所有连接退出后完成的future
     */
    public Future<Void> initiate() {
        if (signal.fire()) {
            log.info("广播关闭信号，等待 {} 个连接退出", tracker.connectionTokens());
        }
        tracker.releaseOwner();
        return tracker.drained();
    }

    public boolean isShuttingDown() {
        return signal.isFired();
    }

    public int activeConnections() {
        return tracker.connectionTokens();
    }
}
