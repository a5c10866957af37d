package site.tinyredis.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.protocol.ArrayFrame;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.ErrorFrame;
import site.tinyredis.protocol.Frame;
import site.tinyredis.protocol.IntegerFrame;
import site.tinyredis.protocol.NullFrame;
import site.tinyredis.protocol.SimpleString;
import site.tinyredis.protocol.handler.FrameDecoder;
import site.tinyredis.protocol.handler.FrameEncoder;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * tinyredis客户端
 *
 * <p>一个实例对应一条连接，请求与响应一一对应，不是线程安全的。
 * 服务器返回的错误帧以{@link ClientException}抛出。
 *
 * <pre>
 * try (TinyRedisClient client = TinyRedisClient.connect("127.0.0.1", 6379)) {
 *     client.set("hello", "world");
 *     Optional&lt;byte[]&gt; value = client.get("hello");
 * }
 * </pre>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class TinyRedisClient implements AutoCloseable {

    private static final int CONNECT_TIMEOUT_MILLIS = 5000;

    private final EventLoopGroup group;

    private final Channel channel;

    private final ClientHandler handler;

    private TinyRedisClient(final EventLoopGroup group, final Channel channel, final ClientHandler handler) {
        this.group = group;
        this.channel = channel;
        this.handler = handler;
    }

    /**
     * 连接服务器
     *
     * @throws ClientException 连接失败
     */
    public static TinyRedisClient connect(final String host, final int port) throws ClientException {
        final EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("tinyredis-client"));
        final ClientHandler handler = new ClientHandler();

        final Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new FrameDecoder())
                                .addLast(FrameEncoder.INSTANCE)
                                .addLast(handler);
                    }
                });

        final ChannelFuture future = bootstrap.connect(host, port).awaitUninterruptibly();
        if (!future.isSuccess()) {
            group.shutdownGracefully();
            throw new ClientException("failed to connect to " + host + ":" + port, future.cause());
        }
        log.debug("已连接到 {}:{}", host, port);
        return new TinyRedisClient(group, future.channel(), handler);
    }

    /**
     * GET key
     *
     * @return 键不存在时返回空
     */
    public Optional<byte[]> get(final String key) throws ClientException {
        final Frame reply = execute(ArrayFrame.ofBulkStrings("get", key));
        if (reply instanceof NullFrame) {
            return Optional.empty();
        }
        if (reply instanceof BulkString) {
            return Optional.of(((BulkString) reply).getContent());
        }
        if (reply instanceof SimpleString) {
            return Optional.of(((SimpleString) reply).getContent().getBytes(StandardCharsets.UTF_8));
        }
        throw unexpected(reply);
    }

    public void set(final String key, final String value) throws ClientException {
        set(key, value.getBytes(StandardCharsets.UTF_8), null);
    }

    public void set(final String key, final byte[] value) throws ClientException {
        set(key, value, null);
    }

    /**
     * SET key value [PX milliseconds]
     *
     * @param expire 存活时间，null表示永不过期
     */
    public void set(final String key, final byte[] value, final Duration expire) throws ClientException {
        final List<Frame> parts = new ArrayList<>();
        parts.add(BulkString.fromString("set"));
        parts.add(BulkString.fromString(key));
        parts.add(BulkString.create(value));
        if (expire != null) {
            parts.add(BulkString.fromString("px"));
            parts.add(BulkString.fromString(Long.toString(expire.toMillis())));
        }
        final Frame reply = execute(new ArrayFrame(parts));
        if (!(reply instanceof SimpleString) || !"OK".equals(((SimpleString) reply).getContent())) {
            throw unexpected(reply);
        }
    }

    /**
     * PUBLISH channel message
     *
     * @return 收到消息的订阅者数量
     */
    public long publish(final String channel, final byte[] message) throws ClientException {
        final Frame reply = execute(ArrayFrame.of(
                BulkString.fromString("publish"),
                BulkString.fromString(channel),
                BulkString.create(message)));
        if (reply instanceof IntegerFrame) {
            return ((IntegerFrame) reply).getContent();
        }
        throw unexpected(reply);
    }

    public long publish(final String channel, final String message) throws ClientException {
        return publish(channel, message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 订阅频道，连接转入订阅模式，之后只能通过返回的{@link Subscriber}使用
     */
    public Subscriber subscribe(final String... channels) throws ClientException {
        final Subscriber subscriber = new Subscriber(this);
        subscriber.subscribe(channels);
        return subscriber;
    }

    /**
     * 发送请求并读取一个响应帧，错误帧抛出{@link ClientException}
     */
    public Frame execute(final Frame request) throws ClientException {
        writeFrame(request);
        final Frame reply = readFrame();
        if (reply instanceof ErrorFrame) {
            throw new ClientException(((ErrorFrame) reply).getContent());
        }
        return reply;
    }

    void writeFrame(final Frame frame) throws ClientException {
        final ChannelFuture future = channel.writeAndFlush(frame).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new ClientException("failed to write request", future.cause());
        }
    }

    Frame readFrame() throws ClientException {
        try {
            return handler.readFrame();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("interrupted while waiting for response", e);
        }
    }

    Frame readFrame(final Duration timeout) throws ClientException {
        try {
            return handler.readFrame(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("interrupted while waiting for response", e);
        }
    }

    static ClientException unexpected(final Frame reply) {
        return new ClientException("unexpected response: " + reply);
    }

    public boolean isConnected() {
        return channel.isActive();
    }

    @Override
    public void close() {
        channel.close().syncUninterruptibly();
        group.shutdownGracefully().syncUninterruptibly();
    }
}
