package site.tinyredis.command.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.tinyredis.command.Command;
import site.tinyredis.command.CommandType;
import site.tinyredis.database.Db;
import site.tinyredis.protocol.FrameParser;
import site.tinyredis.protocol.ProtocolException;
import site.tinyredis.protocol.SimpleString;
import site.tinyredis.server.handler.Connection;

import java.time.Duration;
import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds]
 *
 * <p>覆盖已有的值，同时替换或清除旧的过期时间。
 */
@Slf4j
@Getter
public class Set implements Command {

    /** 允许的最长存活时间 */
    static final Duration MAX_EXPIRE = Duration.ofDays(365L * 100);

    private final String key;

    private final byte[] value;

    /** 存活时间，null表示永不过期 */
    private final Duration expire;

    public Set(final String key, final byte[] value, final Duration expire) {
        this.key = key;
        this.value = value;
        this.expire = expire;
    }

    public static Set parseFrames(final FrameParser parser) throws ProtocolException {
        final String key = parser.nextString();
        final byte[] value = parser.nextBytes();

        Duration expire = null;
        if (parser.hasNext()) {
            final String option = parser.nextString().toUpperCase(Locale.ROOT);
            if ("EX".equals(option)) {
                expire = toExpire(parser.nextLong(), false);
            } else if ("PX".equals(option)) {
                expire = toExpire(parser.nextLong(), true);
            } else {
                throw new ProtocolException("currently `SET` only supports the expiration option");
            }
        }
        return new Set(key, value, expire);
    }

    private static Duration toExpire(final long amount, final boolean millis) throws ProtocolException {
        if (amount <= 0) {
            throw new ProtocolException("invalid expire time in 'set' command");
        }
        final Duration expire = millis ? Duration.ofMillis(amount) : Duration.ofSeconds(amount);
        if (expire.compareTo(MAX_EXPIRE) > 0) {
            throw new ProtocolException("invalid expire time in 'set' command");
        }
        return expire;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void apply(final Db db, final Connection connection) {
        db.set(key, value, expire);
        connection.writeFrame(SimpleString.OK);
        log.debug("SET {} ({} bytes, expire={})", key, value.length, expire);
    }
}
