package site.tinyredis.client;

import site.tinyredis.protocol.ArrayFrame;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.ErrorFrame;
import site.tinyredis.protocol.Frame;
import site.tinyredis.protocol.SimpleString;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 处于订阅模式的连接
 *
 * <p>订阅确认可能与已订阅频道推送的消息交错到达，等待确认期间收到的消息先缓存，
 * 由{@link #nextMessage(Duration)}按到达顺序返回。
 */
public class Subscriber implements AutoCloseable {

    private final TinyRedisClient client;

    private final List<String> subscribedChannels = new ArrayList<>();

    private final Deque<Message> pending = new ArrayDeque<>();

    Subscriber(final TinyRedisClient client) {
        this.client = client;
    }

    public List<String> getSubscribedChannels() {
        return Collections.unmodifiableList(subscribedChannels);
    }

    /**
     * 订阅更多频道，等待每个频道的确认
     */
    public void subscribe(final String... channels) throws ClientException {
        if (channels.length == 0) {
            throw new IllegalArgumentException("至少需要一个频道");
        }
        client.writeFrame(command("subscribe", channels));
        for (final String channel : channels) {
            final List<Frame> confirm = awaitConfirmation("subscribe");
            final String confirmed = text(confirm.get(1));
            if (!channel.equals(confirmed)) {
                throw new ClientException("unexpected subscribe confirmation for " + confirmed + ", expected " + channel);
            }
            if (!subscribedChannels.contains(channel)) {
                subscribedChannels.add(channel);
            }
        }
    }

    /**
     * 退订频道，不传参数时退订全部
     */
    public void unsubscribe(final String... channels) throws ClientException {
        final int expected = channels.length == 0 ? subscribedChannels.size() : channels.length;
        if (expected == 0) {
            return;
        }
        client.writeFrame(command("unsubscribe", channels));
        for (int i = 0; i < expected; i++) {
            final List<Frame> confirm = awaitConfirmation("unsubscribe");
            subscribedChannels.remove(text(confirm.get(1)));
        }
    }

    /**
     * 等待下一条消息
     *
     * @return 超时返回null
     * @throws ClientException 连接关闭或收到非消息帧
     */
    public Message nextMessage(final Duration timeout) throws ClientException {
        if (!pending.isEmpty()) {
            return pending.pollFirst();
        }
        final Frame frame = client.readFrame(timeout);
        if (frame == null) {
            return null;
        }
        final Message message = toMessage(frame);
        if (message == null) {
            throw TinyRedisClient.unexpected(frame);
        }
        return message;
    }

    private List<Frame> awaitConfirmation(final String kind) throws ClientException {
        for (;;) {
            final Frame frame = client.readFrame();
            if (frame instanceof ErrorFrame) {
                throw new ClientException(((ErrorFrame) frame).getContent());
            }
            final Message message = toMessage(frame);
            if (message != null) {
                pending.addLast(message);
                continue;
            }
            if (frame instanceof ArrayFrame) {
                final List<Frame> parts = ((ArrayFrame) frame).getContent();
                if (parts.size() == 3 && kind.equals(text(parts.get(0)))) {
                    return parts;
                }
            }
            throw TinyRedisClient.unexpected(frame);
        }
    }

    private static Message toMessage(final Frame frame) throws ClientException {
        if (!(frame instanceof ArrayFrame)) {
            return null;
        }
        final List<Frame> parts = ((ArrayFrame) frame).getContent();
        if (parts.size() != 3 || !"message".equals(text(parts.get(0)))) {
            return null;
        }
        if (!(parts.get(2) instanceof BulkString)) {
            throw TinyRedisClient.unexpected(frame);
        }
        return new Message(text(parts.get(1)), ((BulkString) parts.get(2)).getContent());
    }

    private static String text(final Frame frame) throws ClientException {
        if (frame instanceof BulkString) {
            return new String(((BulkString) frame).getContentUnsafe(), StandardCharsets.UTF_8);
        }
        if (frame instanceof SimpleString) {
            return ((SimpleString) frame).getContent();
        }
        throw TinyRedisClient.unexpected(frame);
    }

    private static ArrayFrame command(final String name, final String... channels) {
        final String[] parts = new String[channels.length + 1];
        parts[0] = name;
        System.arraycopy(channels, 0, parts, 1, channels.length);
        return ArrayFrame.ofBulkStrings(parts);
    }

    @Override
    public void close() {
        client.close();
    }
}
