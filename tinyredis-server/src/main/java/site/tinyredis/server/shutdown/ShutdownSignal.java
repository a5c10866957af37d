package site.tinyredis.server.shutdown;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;
import io.netty.util.concurrent.ImmediateEventExecutor;
import io.netty.util.concurrent.Promise;

/**
 * 一次性的关闭广播
 *
 * <p>触发后对所有已注册和之后注册的监听器都可见，监听器在触发线程上执行。
 * 不携带任何数据，也不能撤销。
 */
public class ShutdownSignal {

    private final Promise<Void> promise = ImmediateEventExecutor.INSTANCE.newPromise();

    /**
     * 触发关闭，重复调用无效果
     *
     * @return 本次调用是否真正触发了信号
     */
    public boolean fire() {
        return promise.trySuccess(null);
    }

    public boolean isFired() {
        return promise.isDone();
    }

    /**
     * 注册监听器，信号已触发时立即在调用线程上执行
     */
    public void addListener(final GenericFutureListener<Future<Void>> listener) {
        promise.addListener(listener);
    }

    public void removeListener(final GenericFutureListener<Future<Void>> listener) {
        promise.removeListener(listener);
    }
}
