package site.tinyredis.command;

import lombok.AccessLevel;
import lombok.Getter;
import site.tinyredis.command.impl.Get;
import site.tinyredis.command.impl.Publish;
import site.tinyredis.command.impl.Set;
import site.tinyredis.command.impl.Subscribe;
import site.tinyredis.command.impl.Unsubscribe;
import site.tinyredis.protocol.FrameParser;
import site.tinyredis.protocol.ProtocolException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 服务器支持的命令类型
 *
 * <p>每个类型关联一个参数解析工厂，按命令名查找时大小写不敏感。
 * {@link #UNKNOWN}只用于标记未识别的命令，不能通过名字查到。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 字符串命令 ==========
    /** GET命令：获取键值 */
    GET("get", Get::parseFrames, false),
    /** SET命令：设置键值对，可带过期时间 */
    SET("set", Set::parseFrames, false),

    // ========== 发布订阅命令 ==========
    /** PUBLISH命令：向频道发布消息 */
    PUBLISH("publish", Publish::parseFrames, false),
    /** SUBSCRIBE命令：订阅一个或多个频道 */
    SUBSCRIBE("subscribe", Subscribe::parseFrames, true),
    /** UNSUBSCRIBE命令：退订频道，不带参数时退订全部 */
    UNSUBSCRIBE("unsubscribe", Unsubscribe::parseFrames, true),

    /** 未识别的命令 */
    UNKNOWN("unknown", null, false);

    /**
     * 命令参数解析器，从命令名之后的参数构造命令
     */
    @FunctionalInterface
    public interface Parser {
        Command parse(FrameParser parser) throws ProtocolException;
    }

    private static final Map<String, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            if (type != UNKNOWN) {
                COMMAND_CACHE.put(type.name, type);
            }
        }
    }

    /** 小写命令名 */
    private final String name;

    @Getter(AccessLevel.NONE)
    private final Parser parser;

    /** 订阅模式下是否允许执行 */
    private final boolean allowedWhileSubscribed;

    CommandType(final String name, final Parser parser, final boolean allowedWhileSubscribed) {
        this.name = name;
        this.parser = parser;
        this.allowedWhileSubscribed = allowedWhileSubscribed;
    }

    /**
     * 根据命令名查找命令类型
     *
     * @param commandName 命令名，大小写不敏感
     * @return 对应的CommandType，不存在时返回null
     */
    public static CommandType findByName(final String commandName) {
        if (commandName == null || commandName.isEmpty()) {
            return null;
        }
        return COMMAND_CACHE.get(commandName.toLowerCase(Locale.ROOT));
    }

    /**
     * 解析命令名之后的参数
     *
     * @param frameParser 已消费命令名的参数游标
     * @return 命令实例
     * @throws ProtocolException 参数缺失或格式错误
     */
    public Command parse(final FrameParser frameParser) throws ProtocolException {
        if (parser == null) {
            throw new IllegalStateException("命令类型 " + this + " 不支持解析");
        }
        return parser.parse(frameParser);
    }
}
