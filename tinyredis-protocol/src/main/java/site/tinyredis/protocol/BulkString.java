package site.tinyredis.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 批量字符串帧
 *
 * <p>以长度前缀承载任意二进制内容，例如 "$5\r\nhello\r\n"。
 * 不存在的值使用{@link NullFrame}表示，BulkString本身的内容永不为null。
 *
 * <p>使用建议：
 * <ul>
 *     <li>外部传入的数据使用{@link #create(byte[])}，会复制一份</li>
 *     <li>解码器等可信路径使用{@link #wrapTrusted(byte[])}，不复制</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class BulkString extends Frame {
    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 字符串内容的字节表示 */
    private final byte[] content;

    private BulkString(final byte[] content) {
        this.content = content;
    }

    /**
     * 安全模式：复制输入的字节数组
     *
     * @param content 字节数组内容
     * @return BulkString实例
     */
    public static BulkString create(final byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("BulkString内容不能为null，缺失值请使用NullFrame");
        }
        return new BulkString(content.clone());
    }

    /**
     * 零拷贝工厂方法：调用者必须保证数组之后不再被修改
     *
     * @param trustedBytes 受信任的字节数组
     * @return BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            throw new IllegalArgumentException("BulkString内容不能为null，缺失值请使用NullFrame");
        }
        return new BulkString(trustedBytes);
    }

    /**
     * 以UTF-8编码字符串创建BulkString
     *
     * @param str 字符串内容
     * @return BulkString实例
     */
    public static BulkString fromString(final String str) {
        return new BulkString(str.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return 内容的副本
     */
    public byte[] getContent() {
        return content.clone();
    }

    /**
     * @return 内容本身，调用者不得修改
     */
    public byte[] getContentUnsafe() {
        return content;
    }

    public int length() {
        return content.length;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        final int length = content.length;
        if (length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }
        // '$' + 长度数字 + '\r\n' + 内容 + '\r\n'
        byteBuf.ensureWritable(length + 16);
        byteBuf.writeByte('$');
        writeNumber(byteBuf, length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BulkString)) {
            return false;
        }
        return Arrays.equals(content, ((BulkString) o).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    /**
     * @return 按UTF-8解释的内容
     */
    @Override
    public String toString() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
