package site.tinyredis.protocol;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 命令参数游标
 *
 * <p>将一个请求数组帧视为参数序列，按顺序取出字符串、字节或整数。
 * 参数不足、类型不符、或命令解析完成后仍有多余参数时抛出{@link ProtocolException}。
 *
 * <pre>
 * FrameParser parser = new FrameParser(frame);
 * String verb = parser.nextString();
 * ...
 * parser.finish();
 * </pre>
 */
public class FrameParser {

    private final List<Frame> parts;

    private int position;

    /**
     * @param frame 请求帧，必须是数组
     * @throws ProtocolException 帧不是数组
     */
    public FrameParser(final Frame frame) throws ProtocolException {
        if (!(frame instanceof ArrayFrame)) {
            throw new ProtocolException("protocol error; expected array, got " + frame);
        }
        this.parts = ((ArrayFrame) frame).getContent();
    }

    public boolean hasNext() {
        return position < parts.size();
    }

    private Frame next() throws ProtocolException {
        if (!hasNext()) {
            throw new ProtocolException("protocol error; unexpected end of frame");
        }
        return parts.get(position++);
    }

    /**
     * 取下一个参数作为字符串，接受简单字符串与批量字符串
     */
    public String nextString() throws ProtocolException {
        final Frame frame = next();
        if (frame instanceof SimpleString) {
            return ((SimpleString) frame).getContent();
        }
        if (frame instanceof BulkString) {
            return new String(((BulkString) frame).getContentUnsafe(), StandardCharsets.UTF_8);
        }
        throw new ProtocolException("protocol error; expected simple frame or bulk frame, got " + frame);
    }

    /**
     * 取下一个参数的原始字节（副本）
     */
    public byte[] nextBytes() throws ProtocolException {
        final Frame frame = next();
        if (frame instanceof SimpleString) {
            return ((SimpleString) frame).getContent().getBytes(StandardCharsets.UTF_8);
        }
        if (frame instanceof BulkString) {
            return ((BulkString) frame).getContent();
        }
        throw new ProtocolException("protocol error; expected simple frame or bulk frame, got " + frame);
    }

    /**
     * 取下一个参数作为整数，接受整数帧或内容为十进制数字的字符串
     */
    public long nextLong() throws ProtocolException {
        final Frame frame = next();
        if (frame instanceof IntegerFrame) {
            return ((IntegerFrame) frame).getContent();
        }
        final String text;
        if (frame instanceof SimpleString) {
            text = ((SimpleString) frame).getContent();
        } else if (frame instanceof BulkString) {
            text = new String(((BulkString) frame).getContentUnsafe(), StandardCharsets.UTF_8);
        } else {
            throw new ProtocolException("protocol error; expected int frame, got " + frame);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ProtocolException("protocol error; invalid number", e);
        }
    }

    /**
     * 确认所有参数都已被消费
     *
     * @throws ProtocolException 仍有剩余参数
     */
    public void finish() throws ProtocolException {
        if (hasNext()) {
            throw new ProtocolException("protocol error; expected end of frame, but there was more");
        }
    }
}
