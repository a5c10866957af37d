package site.tinyredis.protocol;

/**
 * 协议错误：字节流无法解析为合法帧，或命令参数缺失/格式错误。
 *
 * <p>消息文本会原样作为错误帧内容返回给客户端。
 */
public class ProtocolException extends Exception {

    public ProtocolException(final String message) {
        super(message);
    }

    public ProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
