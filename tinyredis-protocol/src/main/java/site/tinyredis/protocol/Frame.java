package site.tinyredis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * RESP协议帧基础类
 *
 * <p>所有请求与响应在连接上的最小单位。作为全部帧类型的基类，负责：
 * <ul>
 *     <li>协议解析 - 从字节流中解出一个完整的帧</li>
 *     <li>协议编码 - 由子类实现各自的编码逻辑</li>
 *     <li>数字缓存 - 预缓存常用数字的字节表示</li>
 * </ul>
 *
 * <p>支持的帧类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头，长度为-1时表示Null</li>
 *     <li>数组 - 以"*"开头</li>
 * </ul>
 *
 * <p>解码约定：数据不完整时返回null并恢复读索引，等待更多数据；
 * 数据格式错误时抛出{@link ProtocolException}，连接上的字节流已无法继续解析。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public abstract class Frame {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 批量字符串最大长度 512MB */
    static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;

    /** 数组最大元素个数 */
    static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[256][];

    static {
        for (int i = 0; i < NUMBERS.length; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 将帧编码写入缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 写入整数的十进制字节表示，小整数走缓存
     *
     * @param buf 目标缓冲区
     * @param value 整数值
     */
    protected static void writeNumber(final ByteBuf buf, final long value) {
        if (value >= 0 && value < NUMBERS.length) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * RESP 协议解码方法
     * 支持的类型：
     * - SimpleString "+OK\r\n"
     * - Error "-Error message\r\n"
     * - Integer ":0\r\n"
     * - BulkString "$6\r\nfoobar\r\n"
     * - Null "$-1\r\n"
     * - Array "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"
     *
     * @param buffer 输入缓冲区
     * @return 解码后的帧，数据不完整时返回null（读索引不变）
     * @throws ProtocolException 数据不符合RESP协议规范
     */
    public static Frame decode(final ByteBuf buffer) throws ProtocolException {
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeFrame(buffer);
        } catch (IncompleteFrameException e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (ProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Frame decodeFrame(final ByteBuf buffer) throws ProtocolException {
        if (!buffer.isReadable()) {
            throw IncompleteFrameException.INSTANCE;
        }
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case '+':
                return new SimpleString(readLine(buffer));
            case '-':
                return new ErrorFrame(readLine(buffer));
            case ':':
                return IntegerFrame.valueOf(readNumber(buffer));
            case '$':
                return decodeBulk(buffer);
            case '*':
                return decodeArray(buffer);
            default:
                log.debug("无法识别的RESP类型标识: 字节值 {}", typeIndicator & 0xFF);
                throw new ProtocolException("protocol error; invalid frame type byte `" + (typeIndicator & 0xFF) + "`");
        }
    }

    private static Frame decodeBulk(final ByteBuf buffer) throws ProtocolException {
        final long length = readNumber(buffer);
        if (length == -1) {
            return NullFrame.INSTANCE;
        }
        if (length < 0 || length > PROTO_MAX_BULK_LEN) {
            throw new ProtocolException("protocol error; invalid bulk length " + length);
        }
        final int len = (int) length;
        if (buffer.readableBytes() < len + 2) {
            throw IncompleteFrameException.INSTANCE;
        }
        final byte[] content = new byte[len];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("protocol error; bulk string not terminated by CRLF");
        }
        return BulkString.wrapTrusted(content);
    }

    private static Frame decodeArray(final ByteBuf buffer) throws ProtocolException {
        final long number = readNumber(buffer);
        if (number < 0 || number > PROTO_MAX_ARRAY_LEN) {
            throw new ProtocolException("protocol error; invalid array length " + number);
        }
        final Frame[] elements = new Frame[(int) number];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = decodeFrame(buffer);
        }
        return new ArrayFrame(elements);
    }

    /**
     * 读取一行直到 \r\n，用于简单字符串与错误消息
     */
    static String readLine(final ByteBuf buffer) throws ProtocolException {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findCrlf(buffer);
        final String line = buffer.toString(startIndex, endIndex - startIndex, StandardCharsets.UTF_8);
        buffer.readerIndex(endIndex + 2);
        return line;
    }

    /**
     * 读取一个十进制整数直到 \r\n，用于整数帧与长度前缀
     */
    static long readNumber(final ByteBuf buffer) throws ProtocolException {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findCrlf(buffer);
        final int length = endIndex - startIndex;
        if (length == 0) {
            throw new ProtocolException("protocol error; invalid frame format: empty number");
        }

        final boolean negative = buffer.getByte(startIndex) == '-';
        final int digitsStart = negative ? startIndex + 1 : startIndex;
        if (digitsStart == endIndex || endIndex - digitsStart > 18) {
            throw new ProtocolException("protocol error; invalid frame format: bad number");
        }
        long value = 0;
        for (int i = digitsStart; i < endIndex; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("protocol error; invalid frame format: bad number");
            }
            value = value * 10 + (b - '0');
        }
        buffer.readerIndex(endIndex + 2);
        return negative ? -value : value;
    }

    /**
     * 定位当前行的 \r，要求其后紧跟 \n
     *
     * @return \r 所在下标
     */
    private static int findCrlf(final ByteBuf buffer) throws ProtocolException {
        final int startIndex = buffer.readerIndex();
        final int endIndex = buffer.indexOf(startIndex, buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0 || endIndex + 1 >= buffer.writerIndex()) {
            throw IncompleteFrameException.INSTANCE;
        }
        if (buffer.getByte(endIndex + 1) != '\n') {
            throw new ProtocolException("protocol error; expected CRLF line terminator");
        }
        return endIndex;
    }

    /**
     * 数据不完整信号，仅在解码内部使用，不携带栈信息
     */
    private static final class IncompleteFrameException extends RuntimeException {
        private static final IncompleteFrameException INSTANCE = new IncompleteFrameException();

        private IncompleteFrameException() {
            super("incomplete frame", null, false, false);
        }
    }
}
