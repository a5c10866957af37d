package site.tinyredis.client;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.protocol.Frame;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 把收到的帧交给调用线程
 *
 * <p>事件循环线程只负责入队，调用线程按顺序阻塞读取。连接关闭或出错后，
 * 之后的每次读取都会得到同一个失败。
 */
@Slf4j
class ClientHandler extends SimpleChannelInboundHandler<Frame> {

    /** 连接关闭的标记 */
    private static final Object EOF = new Object();

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Frame frame) {
        inbound.add(frame);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        inbound.add(EOF);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("客户端连接异常: {}", cause.getMessage());
        inbound.add(cause);
        ctx.close();
    }

    /**
     * 阻塞读取下一个帧
     *
     * @throws ClientException 连接已关闭或出错
     */
    Frame readFrame() throws ClientException, InterruptedException {
        return unwrap(inbound.take());
    }

    /**
     * 在超时时间内读取下一个帧
     *
     * @return 超时返回null
     * @throws ClientException 连接已关闭或出错
     */
    Frame readFrame(final long timeout, final TimeUnit unit) throws ClientException, InterruptedException {
        final Object next = inbound.poll(timeout, unit);
        return next == null ? null : unwrap(next);
    }

    private Frame unwrap(final Object next) throws ClientException {
        if (next instanceof Frame) {
            return (Frame) next;
        }
        // 放回队列，保证之后的读取得到同样的失败
        inbound.add(next);
        if (next == EOF) {
            throw new ClientException("connection reset by server");
        }
        throw new ClientException("connection failed: " + ((Throwable) next).getMessage(), (Throwable) next);
    }
}
