package site.tinyredis.pubsub;

/**
 * 订阅者的消息回调。
 *
 * <p>回调在发布者的线程上执行，实现不应阻塞。
 */
@FunctionalInterface
public interface MessageListener {

    void onMessage(Message message);
}
