package site.tinyredis.command.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.command.Command;
import site.tinyredis.command.CommandType;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.FrameParser;
import site.tinyredis.protocol.NullFrame;
import site.tinyredis.protocol.ProtocolException;
import site.tinyredis.server.handler.Connection;

/**
 * GET key
 *
 * <p>键存在时返回批量字符串，不存在时返回空值。
 */
@Slf4j
@Getter
public class Get implements Command {

    private final String key;

    public Get(final String key) {
        this.key = key;
    }

    public static Get parseFrames(final FrameParser parser) throws ProtocolException {
        return new Get(parser.nextString());
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void apply(final Db db, final Connection connection) {
        final byte[] value = db.get(key);
        if (value == null) {
            connection.writeFrame(NullFrame.INSTANCE);
        } else {
            connection.writeFrame(BulkString.wrapTrusted(value));
        }
        log.debug("GET {} -> {}", key, value == null ? "(nil)" : value.length + " bytes");
    }
}
