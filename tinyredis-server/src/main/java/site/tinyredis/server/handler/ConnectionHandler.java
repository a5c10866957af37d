package site.tinyredis.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.command.Command;
import site.tinyredis.command.CommandException;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.ErrorFrame;
import site.tinyredis.protocol.Frame;
import site.tinyredis.protocol.ProtocolException;
import site.tinyredis.server.shutdown.ShutdownSignal;

import java.io.IOException;

/**
 * 单个连接的命令处理器
 *
 * <p>处理流程：
 * <ul>
 *   <li>将解码后的请求帧解析为命令，参数错误写回错误帧，连接保持可用
 *   <li>订阅模式下只接受SUBSCRIBE/UNSUBSCRIBE，其余命令写回错误帧
 *   <li>执行命令，命令自己写回响应；致命错误在写回后关闭连接
 * </ul>
 *
 * <p>关闭流程：收到关闭信号后停止读取，已到达但未处理的帧被丢弃，
 * 已排队的响应写完后关闭连接。正在执行的命令不会被打断，因为信号回调与命令执行都在同一个事件循环线程上。
 *
 * <p>字节层面的解码错误与I/O错误不可恢复，记录后关闭连接。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class ConnectionHandler extends SimpleChannelInboundHandler<Frame> {

    private final Db db;

    private final ShutdownSignal shutdownSignal;

    private Connection connection;

    private GenericFutureListener<Future<Void>> shutdownListener;

    private boolean shuttingDown;

    public ConnectionHandler(final Db db, final ShutdownSignal shutdownSignal) {
        if (db == null || shutdownSignal == null) {
            throw new IllegalArgumentException("db和shutdownSignal不能为null");
        }
        this.db = db;
        this.shutdownSignal = shutdownSignal;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        connection = new Connection(ctx.channel());
        shutdownListener = future -> {
            if (ctx.executor().inEventLoop()) {
                beginShutdown(ctx);
            } else {
                ctx.executor().execute(() -> beginShutdown(ctx));
            }
        };
        shutdownSignal.addListener(shutdownListener);
        log.debug("连接建立: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Frame frame) {
        if (shuttingDown) {
            log.debug("服务器正在关闭，丢弃请求: {}", frame);
            return;
        }

        final Command command;
        try {
            command = Command.fromFrame(frame);
        } catch (ProtocolException e) {
            log.debug("命令解析失败: {}", e.getMessage());
            connection.writeFrame(new ErrorFrame("ERR " + e.getMessage()));
            return;
        }

        if (connection.isSubscribed() && !command.getType().isAllowedWhileSubscribed()) {
            connection.writeFrame(new ErrorFrame("ERR Can't execute '" + command.getName()
                    + "': only (UN)SUBSCRIBE are allowed in this context"));
            return;
        }

        try {
            command.apply(db, connection);
        } catch (CommandException e) {
            connection.writeFrame(new ErrorFrame(e.getMessage()));
            if (e.isFatal()) {
                log.warn("命令 {} 执行失败，关闭连接 {}: {}", command.getName(),
                        ctx.channel().remoteAddress(), e.getMessage());
                connection.closeAfterPendingWrites();
            }
        }
    }

    private void beginShutdown(final ChannelHandlerContext ctx) {
        if (shuttingDown) {
            return;
        }
        shuttingDown = true;
        ctx.channel().config().setAutoRead(false);
        connection.unsubscribeAll();
        connection.closeAfterPendingWrites();
        log.debug("收到关闭信号，连接 {} 在写完响应后关闭", ctx.channel().remoteAddress());
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (shutdownListener != null) {
            shutdownSignal.removeListener(shutdownListener);
        }
        if (connection != null) {
            connection.unsubscribeAll();
        }
        log.debug("连接关闭: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof DecoderException) {
            log.error("协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else if (cause instanceof IOException) {
            log.warn("连接异常 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常: {}", cause.getMessage(), cause);
        }
        ctx.close();
    }
}
