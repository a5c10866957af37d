package site.tinyredis.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.database.DbDropGuard;
import site.tinyredis.protocol.handler.FrameDecoder;
import site.tinyredis.protocol.handler.FrameEncoder;
import site.tinyredis.server.config.ServerConfig;
import site.tinyredis.server.handler.ConnectionHandler;
import site.tinyredis.server.shutdown.ShutdownCoordinator;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于Netty的tinyredis服务器
 *
 * <p>组成部分：
 * <ul>
 *   <li>共享数据库 - 由{@link DbDropGuard}持有，关闭时停止过期清理线程
 *   <li>监听通道 - 由{@link Listener}驱动accept循环，{@link AdmissionGate}限制并发连接数
 *   <li>连接管道 - 解码器、编码器和{@link ConnectionHandler}
 *   <li>关闭协调 - {@link ShutdownCoordinator}广播关闭并等待所有连接退出
 * </ul>
 *
 * <p>关闭顺序：广播关闭信号，关闭监听通道，等待所有连接退出，关闭数据库，最后释放事件循环。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
@Getter
public class TinyRedisServer implements RedisServer {

    private final ServerConfig config;

    private final DbDropGuard dbHolder = new DbDropGuard();

    private final ShutdownCoordinator shutdownCoordinator = new ShutdownCoordinator();

    private final AdmissionGate admissionGate;

    private final Listener listener;

    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    private volatile Channel serverChannel;

    private final AtomicBoolean stopped = new AtomicBoolean();

    public TinyRedisServer(final ServerConfig config) {
        config.validate();
        this.config = config;
        this.admissionGate = new AdmissionGate(config.getMaxConnections());
        this.listener = new Listener(
                admissionGate,
                new AcceptBackoff(config.getInitialAcceptBackoff(), config.getMaxAcceptBackoff()),
                shutdownCoordinator);
        initializeEventLoopGroups();
    }

    @Override
    @SuppressWarnings("deprecation")
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("服务器已经启动");
        }
        if (stopped.get()) {
            throw new IllegalStateException("服务器已经关闭");
        }

        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                // 由Listener在拿到许可后逐个accept
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.MAX_MESSAGES_PER_READ, 1)
                .handler(listener)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new FrameDecoder());
                        pipeline.addLast(FrameEncoder.INSTANCE);
                        pipeline.addLast(new ConnectionHandler(dbHolder.db(), shutdownCoordinator.signal()));
                    }
                });

        serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        log.info("tinyredis server started at {}, max connections {}", serverChannel.localAddress(),
                config.getMaxConnections());
    }

    @Override
    public void run(final CompletionStage<?> shutdownTrigger) throws Exception {
        final CompletableFuture<Void> acceptFailed = new CompletableFuture<>();
        Throwable failure = null;
        try {
            // 绑定失败同样要经过stop()释放事件循环和清理线程
            if (serverChannel == null) {
                start();
            }

            listener.acceptFailure().addListener(future -> {
                if (!future.isSuccess()) {
                    acceptFailed.completeExceptionally(future.cause());
                }
            });

            CompletableFuture.anyOf(shutdownTrigger.toCompletableFuture(), acceptFailed).get();
            log.info("收到关闭请求");
        } catch (ExecutionException e) {
            if (acceptFailed.isCompletedExceptionally()) {
                failure = e.getCause();
                log.error("accept失败，服务器关闭: {}", failure.getMessage());
            } else {
                log.info("关闭触发器异常完成，按关闭请求处理: {}", e.getCause().getMessage());
            }
        } finally {
            stop();
        }

        if (failure instanceof Exception) {
            throw (Exception) failure;
        }
        if (failure != null) {
            throw new IllegalStateException("accept失败", failure);
        }
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            // 先广播关闭，监听通道随后的关闭属于正常流程
            shutdownCoordinator.signal().fire();
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            shutdownCoordinator.initiate().sync();
            log.info("所有连接已退出");
        } catch (InterruptedException e) {
            log.error("tinyredis server stop interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            dbHolder.close();
            workerGroup.shutdownGracefully().syncUninterruptibly();
            bossGroup.shutdownGracefully().syncUninterruptibly();
            log.info("tinyredis server stopped");
        }
    }

    @Override
    public InetSocketAddress getLocalAddress() {
        final Channel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("服务器尚未启动");
        }
        return (InetSocketAddress) channel.localAddress();
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (config.isNativeTransport() && Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (config.isNativeTransport() && KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }
}
