package site.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误帧，例如 "-ERR unknown command 'foo'\r\n"
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class ErrorFrame extends Frame {
    private final String content;

    public ErrorFrame(final String content) {
        this.content = content;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
