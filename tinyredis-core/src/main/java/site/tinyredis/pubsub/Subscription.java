package site.tinyredis.pubsub;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 一个订阅者在某个频道上的接收端。
 *
 * <p>关闭后不再收到消息，并从频道注册表中移除；频道没有订阅者时注册表中不再保留该频道。
 * 重复关闭是安全的。
 */
@Slf4j
public final class Subscription implements AutoCloseable {

    private final String channel;

    private final MessageListener listener;

    private final Consumer<Subscription> onClose;

    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param channel 频道名
     * @param listener 消息回调
     * @param onClose 关闭时执行的注销动作，只会执行一次
     */
    public Subscription(final String channel, final MessageListener listener, final Consumer<Subscription> onClose) {
        this.channel = channel;
        this.listener = listener;
        this.onClose = onClose;
    }

    public String getChannel() {
        return channel;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 投递一条消息，已关闭时忽略
     */
    public void deliver(final Message message) {
        if (closed.get()) {
            return;
        }
        try {
            listener.onMessage(message);
        } catch (RuntimeException e) {
            // 单个订阅者的失败不影响同频道的其他订阅者
            log.error("投递消息到频道 {} 的订阅者失败", channel, e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.accept(this);
        }
    }
}
