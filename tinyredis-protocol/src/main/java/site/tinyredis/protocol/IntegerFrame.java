package site.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 整数帧，用于计数类回复，例如 ":3\r\n"
 *
 * <p>小整数实例被缓存，优先使用{@link #valueOf(long)}。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class IntegerFrame extends Frame {
    private static final int CACHE_LOW = -1;

    private static final int CACHE_HIGH = 127;

    private static final IntegerFrame[] CACHE = new IntegerFrame[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new IntegerFrame(i + CACHE_LOW);
        }
    }

    public static final IntegerFrame ZERO = CACHE[-CACHE_LOW];

    private final long content;

    private IntegerFrame(final long content) {
        this.content = content;
    }

    public static IntegerFrame valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new IntegerFrame(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeNumber(byteBuf, content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return Long.toString(content);
    }
}
