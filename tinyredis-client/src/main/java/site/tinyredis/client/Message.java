package site.tinyredis.client;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 订阅收到的一条消息
 */
@Getter
public final class Message {

    private final String channel;

    private final byte[] content;

    public Message(final String channel, final byte[] content) {
        this.channel = channel;
        this.content = content;
    }

    public String getContentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Message{channel=" + channel + ", content=" + getContentAsString() + "}";
    }
}
