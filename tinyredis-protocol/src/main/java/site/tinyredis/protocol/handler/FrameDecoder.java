package site.tinyredis.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.protocol.ArrayFrame;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.Frame;
import site.tinyredis.protocol.ProtocolException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>把连接上的字节流切分为完整的{@link Frame}，半包留在累积缓冲区中等待后续数据。
 * 基于Netty的ByteToMessageDecoder，支持：
 * <ul>
 *     <li>RESP格式 - 全部帧类型</li>
 *     <li>INLINE格式 - 以空白分隔的文本命令，如 "GET key\r\n"，解码为批量字符串数组</li>
 * </ul>
 *
 * <p>格式错误不可恢复：字节流已失去帧边界，解码器抛出{@link ProtocolException}，
 * 由Netty包装为DecoderException交给后续处理器关闭连接。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class FrameDecoder extends ByteToMessageDecoder {

    /** 最大内联命令长度限制 */
    private static final int MAX_INLINE_LENGTH = 64 * 1024;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) throws Exception {
        // 1. 跳过前导的换行符
        while (in.isReadable()) {
            final byte b = in.getByte(in.readerIndex());
            if (b != '\r' && b != '\n') {
                break;
            }
            in.skipBytes(1);
        }
        if (!in.isReadable()) {
            return;
        }

        // 2. 判断是RESP格式还是INLINE格式
        final Frame frame = isRespType(in.getByte(in.readerIndex()))
                ? Frame.decode(in)
                : decodeInline(in);
        if (frame != null) {
            log.debug("成功解码帧: {}", frame.getClass().getSimpleName());
            out.add(frame);
        }
    }

    /**
     * 解码INLINE格式命令（如：GET key\r\n）
     *
     * @return 批量字符串数组，数据不完整或空行时返回null
     */
    private Frame decodeInline(final ByteBuf in) throws ProtocolException {
        final int startIndex = in.readerIndex();
        final int lineEnd = in.indexOf(startIndex, in.writerIndex(), (byte) '\n');
        if (lineEnd < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                throw new ProtocolException("protocol error; too big inline request");
            }
            return null;
        }

        int contentEnd = lineEnd;
        if (contentEnd > startIndex && in.getByte(contentEnd - 1) == '\r') {
            contentEnd--;
        }
        final String line = in.toString(startIndex, contentEnd - startIndex, StandardCharsets.UTF_8);
        in.readerIndex(lineEnd + 1);

        final List<Frame> parts = new ArrayList<>();
        for (final String part : line.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                parts.add(BulkString.fromString(part));
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        log.debug("解析INLINE命令: {}", line);
        return new ArrayFrame(parts);
    }

    private static boolean isRespType(final byte b) {
        return b == '+' || b == '-' || b == ':' || b == '$' || b == '*';
    }
}
