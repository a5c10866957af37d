package site.tinyredis.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.protocol.Frame;

/**
 * RESP协议编码器，无状态，可在多个连接间共享
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
@ChannelHandler.Sharable
public class FrameEncoder extends MessageToByteEncoder<Frame> {

    public static final FrameEncoder INSTANCE = new FrameEncoder();

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Frame msg, final ByteBuf out) {
        msg.encode(out);
        if (log.isDebugEnabled()) {
            log.debug("成功编码响应: {} (大小: {} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
        }
    }
}
