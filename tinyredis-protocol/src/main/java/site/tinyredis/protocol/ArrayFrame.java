package site.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 数组帧
 *
 * <p>请求总是以数组形式出现，首元素为命令名；发布订阅的推送消息也以数组形式返回。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@EqualsAndHashCode(callSuper = false)
public class ArrayFrame extends Frame {
    private final List<Frame> content;

    public ArrayFrame(final Frame[] content) {
        this(Arrays.asList(content.clone()));
    }

    public ArrayFrame(final List<Frame> content) {
        this.content = Collections.unmodifiableList(new ArrayList<>(content));
    }

    public static ArrayFrame of(final Frame... elements) {
        return new ArrayFrame(elements);
    }

    /**
     * 以批量字符串构造数组，命令请求的常见形式
     *
     * @param parts 各元素的字符串内容
     * @return 数组帧
     */
    public static ArrayFrame ofBulkStrings(final String... parts) {
        final Frame[] elements = new Frame[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = BulkString.fromString(parts[i]);
        }
        return new ArrayFrame(elements);
    }

    public List<Frame> getContent() {
        return content;
    }

    public int size() {
        return content.size();
    }

    public Frame get(final int index) {
        return content.get(index);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('*');
        writeNumber(byteBuf, content.size());
        byteBuf.writeBytes(CRLF);
        for (final Frame element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public String toString() {
        return content.toString();
    }
}
