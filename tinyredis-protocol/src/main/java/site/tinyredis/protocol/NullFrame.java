package site.tinyredis.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * Null帧，表示值不存在，编码为 "$-1\r\n"
 */
public final class NullFrame extends Frame {
    public static final NullFrame INSTANCE = new NullFrame();

    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private NullFrame() {
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeBytes(NULL_BYTES);
    }

    @Override
    public String toString() {
        return "(nil)";
    }
}
