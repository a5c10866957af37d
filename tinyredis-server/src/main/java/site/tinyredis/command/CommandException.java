package site.tinyredis.command;

import lombok.Getter;

/**
 * 命令执行失败
 *
 * <p>消息内容会作为错误帧原样写回客户端。致命错误在写回后关闭连接。
 */
@Getter
public class CommandException extends Exception {

    private final boolean fatal;

    public CommandException(final String message) {
        this(message, false);
    }

    public CommandException(final String message, final boolean fatal) {
        super(message);
        this.fatal = fatal;
    }
}
