package site.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 简单字符串帧，用于状态回复，例如 "+OK\r\n"
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class SimpleString extends Frame {
    public static final SimpleString OK = new SimpleString("OK");

    private final String content;

    public SimpleString(final String content) {
        this.content = content;
    }

    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
