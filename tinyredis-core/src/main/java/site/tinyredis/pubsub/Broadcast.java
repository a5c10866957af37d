package site.tinyredis.pubsub;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个频道的广播发送端，把一条消息扇出给当前的全部订阅者。
 *
 * <p>非线程安全：接收者集合只在{@code Db}的锁内修改与快照，投递在锁外进行。
 */
public final class Broadcast {

    private final String channel;

    private final List<Subscription> receivers = new ArrayList<>();

    public Broadcast(final String channel) {
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }

    public void add(final Subscription subscription) {
        receivers.add(subscription);
    }

    /**
     * @return 移除后是否已无订阅者
     */
    public boolean remove(final Subscription subscription) {
        receivers.remove(subscription);
        return receivers.isEmpty();
    }

    public int receiverCount() {
        return receivers.size();
    }

    /**
     * @return 当前接收者的快照，供锁外投递
     */
    public Subscription[] snapshot() {
        return receivers.toArray(new Subscription[0]);
    }
}
