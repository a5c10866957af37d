package site.tinyredis.command.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.command.Command;
import site.tinyredis.command.CommandType;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.ArrayFrame;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.FrameParser;
import site.tinyredis.protocol.IntegerFrame;
import site.tinyredis.protocol.ProtocolException;
import site.tinyredis.server.handler.Connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SUBSCRIBE channel [channel ...]
 *
 * <p>每个频道回复一条{@code ["subscribe", channel, count]}确认，count为当前连接的订阅总数。
 * 执行后连接进入订阅模式，频道上的消息以{@code ["message", channel, payload]}推送。
 */
@Slf4j
@Getter
public class Subscribe implements Command {

    private static final BulkString SUBSCRIBE = BulkString.fromString("subscribe");

    private final List<String> channels;

    public Subscribe(final List<String> channels) {
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
    }

    public static Subscribe parseFrames(final FrameParser parser) throws ProtocolException {
        final List<String> channels = new ArrayList<>();
        // 至少一个频道
        channels.add(parser.nextString());
        while (parser.hasNext()) {
            channels.add(parser.nextString());
        }
        return new Subscribe(channels);
    }

    @Override
    public CommandType getType() {
        return CommandType.SUBSCRIBE;
    }

    @Override
    public void apply(final Db db, final Connection connection) {
        for (final String channel : channels) {
            connection.subscribe(db, channel);
            connection.writeFrame(ArrayFrame.of(
                    SUBSCRIBE,
                    BulkString.fromString(channel),
                    IntegerFrame.valueOf(connection.subscriptionCount())));
        }
        log.debug("SUBSCRIBE {} -> {} subscriptions", channels, connection.subscriptionCount());
    }
}
