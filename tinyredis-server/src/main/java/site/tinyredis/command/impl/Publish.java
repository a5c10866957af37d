package site.tinyredis.command.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.command.Command;
import site.tinyredis.command.CommandType;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.FrameParser;
import site.tinyredis.protocol.IntegerFrame;
import site.tinyredis.protocol.ProtocolException;
import site.tinyredis.server.handler.Connection;

/**
 * PUBLISH channel message
 *
 * <p>返回收到消息的订阅者数量。
 */
@Slf4j
@Getter
public class Publish implements Command {

    private final String channel;

    private final byte[] message;

    public Publish(final String channel, final byte[] message) {
        this.channel = channel;
        this.message = message;
    }

    public static Publish parseFrames(final FrameParser parser) throws ProtocolException {
        final String channel = parser.nextString();
        final byte[] message = parser.nextBytes();
        return new Publish(channel, message);
    }

    @Override
    public CommandType getType() {
        return CommandType.PUBLISH;
    }

    @Override
    public void apply(final Db db, final Connection connection) {
        final int receivers = db.publish(channel, message);
        connection.writeFrame(IntegerFrame.valueOf(receivers));
        log.debug("PUBLISH {} -> {} receivers", channel, receivers);
    }
}
