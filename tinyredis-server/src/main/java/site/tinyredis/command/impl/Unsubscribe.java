package site.tinyredis.command.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.command.Command;
import site.tinyredis.command.CommandException;
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
 * UNSUBSCRIBE [channel ...]
 *
 * <p>不带参数时退订当前连接的全部频道。每个频道回复一条{@code ["unsubscribe", channel, remaining]}，
 * remaining降为0时连接回到请求/响应模式。
 *
 * <p>只能在订阅模式下使用，否则视为致命错误。
 */
@Slf4j
@Getter
public class Unsubscribe implements Command {

    private static final BulkString UNSUBSCRIBE = BulkString.fromString("unsubscribe");

    private final List<String> channels;

    public Unsubscribe(final List<String> channels) {
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
    }

    public static Unsubscribe parseFrames(final FrameParser parser) throws ProtocolException {
        final List<String> channels = new ArrayList<>();
        while (parser.hasNext()) {
            channels.add(parser.nextString());
        }
        return new Unsubscribe(channels);
    }

    @Override
    public CommandType getType() {
        return CommandType.UNSUBSCRIBE;
    }

    @Override
    public void apply(final Db db, final Connection connection) throws CommandException {
        if (!connection.isSubscribed()) {
            throw new CommandException("ERR 'unsubscribe' is only valid in subscription mode", true);
        }

        final List<String> targets = channels.isEmpty() ? connection.subscribedChannels() : channels;
        for (final String channel : targets) {
            connection.unsubscribe(channel);
            connection.writeFrame(ArrayFrame.of(
                    UNSUBSCRIBE,
                    BulkString.fromString(channel),
                    IntegerFrame.valueOf(connection.subscriptionCount())));
        }
        log.debug("UNSUBSCRIBE {} -> {} subscriptions", targets, connection.subscriptionCount());
    }
}
