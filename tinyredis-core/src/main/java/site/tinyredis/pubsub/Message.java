package site.tinyredis.pubsub;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 频道上发布的一条消息
 */
@Getter
public final class Message {
    /** 频道名 */
    private final String channel;

    /** 消息内容 */
    private final byte[] payload;

    public Message(final String channel, final byte[] payload) {
        this.channel = channel;
        this.payload = payload;
    }

    @Override
    public String toString() {
        return "Message{channel=" + channel + ", payload=" + new String(payload, StandardCharsets.UTF_8) + "}";
    }
}
