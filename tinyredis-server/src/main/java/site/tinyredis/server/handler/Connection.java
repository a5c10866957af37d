package site.tinyredis.server.handler;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.ArrayFrame;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.Frame;
import site.tinyredis.pubsub.Message;
import site.tinyredis.pubsub.Subscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个客户端连接的出站写入端与订阅状态
 *
 * <p>订阅表只在连接所属的事件循环线程上修改。发布者线程推送消息时直接写入通道，
 * 由Netty负责切换到事件循环线程。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class Connection {

    private static final BulkString MESSAGE = BulkString.fromString("message");

    /** 写失败视为连接错误，记录后关闭连接 */
    private static final ChannelFutureListener CLOSE_ON_WRITE_FAILURE = future -> {
        if (!future.isSuccess()) {
            log.error("响应写入失败，关闭连接 {}: {}", future.channel().remoteAddress(),
                    future.cause().getMessage(), future.cause());
            future.channel().close();
        }
    };

    private final Channel channel;

    /** 频道名到订阅句柄，保持订阅顺序 */
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    public Connection(final Channel channel) {
        this.channel = channel;
    }

    public Channel channel() {
        return channel;
    }

    /**
     * 写出一个响应帧并立即刷新
     *
     * @param frame 响应帧
     * @return 写操作的future
     */
    public ChannelFuture writeFrame(final Frame frame) {
        return channel.writeAndFlush(frame).addListener(CLOSE_ON_WRITE_FAILURE);
    }

    /**
     * 订阅频道，已订阅的频道不重复注册
     *
     * @return 是否新增了订阅
     */
    public boolean subscribe(final Db db, final String channelName) {
        if (subscriptions.containsKey(channelName)) {
            return false;
        }
        final Subscription subscription = db.subscribe(channelName, this::push);
        subscriptions.put(channelName, subscription);
        return true;
    }

    /**
     * 退订频道
     *
     * @return 该频道此前是否已订阅
     */
    public boolean unsubscribe(final String channelName) {
        final Subscription subscription = subscriptions.remove(channelName);
        if (subscription == null) {
            return false;
        }
        subscription.close();
        return true;
    }

    /**
     * 退订全部频道，连接关闭时调用
     */
    public void unsubscribeAll() {
        for (final Subscription subscription : subscriptions.values()) {
            subscription.close();
        }
        subscriptions.clear();
    }

    public boolean isSubscribed() {
        return !subscriptions.isEmpty();
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public List<String> subscribedChannels() {
        return new ArrayList<>(subscriptions.keySet());
    }

    /**
     * 等已排队的写操作完成后关闭连接
     */
    public void closeAfterPendingWrites() {
        channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
    }

    private void push(final Message message) {
        if (!channel.isActive()) {
            return;
        }
        writeFrame(ArrayFrame.of(
                MESSAGE,
                BulkString.fromString(message.getChannel()),
                BulkString.wrapTrusted(message.getPayload())));
    }
}
