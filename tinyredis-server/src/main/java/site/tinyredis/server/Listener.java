package site.tinyredis.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelConfig;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.server.shutdown.DrainToken;
import site.tinyredis.server.shutdown.ShutdownCoordinator;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 监听通道上的accept循环
 *
 * <p>监听通道关闭了autoRead且每次read只accept一个连接。循环如下：
 * <ol>
 *   <li>向{@link AdmissionGate}申请许可，许可不足时等待，不占用线程
 *   <li>拿到许可后发起一次read，accept一个连接
 *   <li>新连接领取排空令牌，许可和令牌都挂在该连接的closeFuture上，任何原因关闭都会归还
 *   <li>回到第1步
 * </ol>
 *
 * <p>accept失败时按{@link AcceptBackoff}等待后重试，超过上限后{@link #acceptFailure()}以该异常失败。
 * 监听通道在关闭流程之外被关闭时，{@link #acceptFailure()}同样失败。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class Listener extends ChannelInboundHandlerAdapter {

    private final AdmissionGate gate;

    private final AcceptBackoff backoff;

    private final ShutdownCoordinator coordinator;

    private final Promise<Void> acceptFailure = GlobalEventExecutor.INSTANCE.newPromise();

    /** 以下字段只在监听通道的事件循环线程上访问 */
    private Future<AdmissionGate.Permit> pendingAcquire;

    private AdmissionGate.Permit pendingPermit;

    public Listener(final AdmissionGate gate, final AcceptBackoff backoff, final ShutdownCoordinator coordinator) {
        this.gate = gate;
        this.backoff = backoff;
        this.coordinator = coordinator;
    }

    /**
     * accept重试超过上限时以最后一次的异常失败，监听通道意外关闭时同样失败，正常关闭时不会完成
     */
    public Future<Void> acceptFailure() {
        return acceptFailure;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        requestNext(ctx);
        super.channelActive(ctx);
    }

    private void requestNext(final ChannelHandlerContext ctx) {
        final Future<AdmissionGate.Permit> acquire = gate.acquire(ctx.executor());
        pendingAcquire = acquire;
        acquire.addListener(future -> {
            if (!future.isSuccess()) {
                return;
            }
            final AdmissionGate.Permit permit = acquire.getNow();
            if (!ctx.channel().isActive()) {
                permit.close();
                return;
            }
            pendingPermit = permit;
            ctx.read();
        });
        if (!acquire.isDone()) {
            log.debug("已达到最大连接数 {}，等待连接退出", gate.maxPermits());
        }
    }

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) throws Exception {
        final Channel child = (Channel) msg;
        final AdmissionGate.Permit permit = pendingPermit;
        pendingPermit = null;
        if (permit == null) {
            throw new IllegalStateException("没有许可时accept了连接 " + child.remoteAddress());
        }

        final DrainToken token;
        try {
            token = coordinator.enlist();
        } catch (IllegalStateException e) {
            permit.close();
            child.close();
            log.warn("服务器已关闭，拒绝连接 {}", child.remoteAddress());
            return;
        }

        child.closeFuture().addListener(future -> {
            permit.close();
            token.close();
        });
        backoff.reset();
        log.debug("接受连接 {}", child.remoteAddress());

        ctx.fireChannelRead(child);
        requestNext(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        // 失败的read仍处于pending状态，监听通道保留着accept兴趣，backlog中的连接会让selector立即再次触发。
        // 切换一次autoRead触发autoReadCleared()，撤销accept兴趣，等到重试时再由ctx.read()重新注册
        clearReadInterest(ctx.channel());
        final Duration delay = backoff.next();
        if (delay == null) {
            log.error("accept持续失败，放弃重试: {}", cause.getMessage(), cause);
            acceptFailure.tryFailure(cause);
            return;
        }
        log.warn("accept失败，{} ms后重试: {}", delay.toMillis(), cause.getMessage());
        ctx.executor().schedule(() -> {
            if (ctx.channel().isActive() && pendingPermit != null) {
                ctx.read();
            }
        }, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static void clearReadInterest(final Channel channel) {
        final ChannelConfig config = channel.config();
        if (config.isAutoRead()) {
            return;
        }
        config.setAutoRead(true);
        config.setAutoRead(false);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (!coordinator.isShuttingDown()) {
            // 监听通道在关闭流程之外关闭，例如accept遇到非IO异常，此后不会再有新连接
            log.error("监听通道意外关闭: {}", ctx.channel().localAddress());
            acceptFailure.tryFailure(new IllegalStateException("监听通道意外关闭: " + ctx.channel().localAddress()));
        }
        if (pendingAcquire != null) {
            pendingAcquire.cancel(false);
        }
        if (pendingPermit != null) {
            pendingPermit.close();
            pendingPermit = null;
        }
        super.channelInactive(ctx);
    }
}
