package site.tinyredis.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.tinyredis.command.impl.Get;
import site.tinyredis.command.impl.Publish;
import site.tinyredis.command.impl.Set;
import site.tinyredis.command.impl.Subscribe;
import site.tinyredis.command.impl.Unknown;
import site.tinyredis.command.impl.Unsubscribe;
import site.tinyredis.protocol.ArrayFrame;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.IntegerFrame;
import site.tinyredis.protocol.ProtocolException;
import site.tinyredis.protocol.SimpleString;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("命令解析测试")
class CommandTest {

    private static Command parse(final String... parts) throws ProtocolException {
        return Command.fromFrame(ArrayFrame.ofBulkStrings(parts));
    }

    @Test
    @DisplayName("命令名大小写不敏感")
    void testVerbIsCaseInsensitive() throws Exception {
        assertThat(parse("GET", "k")).isInstanceOf(Get.class);
        assertThat(parse("get", "k")).isInstanceOf(Get.class);
        assertThat(parse("GeT", "k")).isInstanceOf(Get.class);
        assertThat(CommandType.findByName("PUBLISH")).isEqualTo(CommandType.PUBLISH);
        assertThat(CommandType.findByName("unknown")).isNull();
    }

    @Test
    @DisplayName("GET解析键")
    void testParseGet() throws Exception {
        final Get get = (Get) parse("get", "hello");
        assertThat(get.getKey()).isEqualTo("hello");
        assertThat(get.getType()).isEqualTo(CommandType.GET);
    }

    @Test
    @DisplayName("SET不带过期时间")
    void testParseSetWithoutExpire() throws Exception {
        final Set set = (Set) parse("set", "hello", "world");
        assertThat(set.getKey()).isEqualTo("hello");
        assertThat(new String(set.getValue(), StandardCharsets.UTF_8)).isEqualTo("world");
        assertThat(set.getExpire()).isNull();
    }

    @Test
    @DisplayName("SET支持EX和PX，选项大小写不敏感")
    void testParseSetWithExpire() throws Exception {
        assertThat(((Set) parse("set", "k", "v", "EX", "60")).getExpire()).isEqualTo(Duration.ofSeconds(60));
        assertThat(((Set) parse("set", "k", "v", "px", "1500")).getExpire()).isEqualTo(Duration.ofMillis(1500));

        final ArrayFrame withInteger = ArrayFrame.of(
                BulkString.fromString("set"), BulkString.fromString("k"), BulkString.fromString("v"),
                BulkString.fromString("ex"), IntegerFrame.valueOf(10));
        assertThat(((Set) Command.fromFrame(withInteger)).getExpire()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("SET的过期时间必须是正整数")
    void testParseSetInvalidExpire() {
        assertThatThrownBy(() -> parse("set", "k", "v", "EX", "abc")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> parse("set", "k", "v", "EX", "0")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> parse("set", "k", "v", "PX", "-5")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> parse("set", "k", "v", "EX", String.valueOf(Long.MAX_VALUE)))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> parse("set", "k", "v", "EX"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("unexpected end of frame");
    }

    @Test
    @DisplayName("SET只支持过期选项")
    void testParseSetUnknownOption() {
        assertThatThrownBy(() -> parse("set", "k", "v", "NX"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("only supports the expiration option");
    }

    @Test
    @DisplayName("参数缺失或多余都解析失败")
    void testMissingAndTrailingArguments() {
        assertThatThrownBy(() -> parse("get")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> parse("set", "k")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> parse("publish", "ch")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> parse("get", "k", "extra"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("expected end of frame");
        assertThatThrownBy(() -> parse("set", "k", "v", "EX", "10", "extra"))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    @DisplayName("请求必须是非空数组")
    void testInvalidRequestShape() {
        assertThatThrownBy(() -> Command.fromFrame(new SimpleString("GET"))).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> Command.fromFrame(ArrayFrame.of())).isInstanceOf(ProtocolException.class);
    }

    @Test
    @DisplayName("未识别的命令不报错，保存小写命令名")
    void testUnknownCommand() throws Exception {
        final Command command = parse("FOO", "bar", "baz");
        assertThat(command).isInstanceOf(Unknown.class);
        assertThat(command.getName()).isEqualTo("foo");
        assertThat(command.getType()).isEqualTo(CommandType.UNKNOWN);
    }

    @Test
    @DisplayName("PUBLISH解析频道和消息")
    void testParsePublish() throws Exception {
        final Publish publish = (Publish) parse("publish", "news", "hello");
        assertThat(publish.getChannel()).isEqualTo("news");
        assertThat(publish.getMessage()).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("SUBSCRIBE至少需要一个频道，UNSUBSCRIBE可以不带参数")
    void testParseSubscriptions() throws Exception {
        assertThat(((Subscribe) parse("subscribe", "a", "b")).getChannels()).containsExactly("a", "b");
        assertThatThrownBy(() -> parse("subscribe")).isInstanceOf(ProtocolException.class);

        assertThat(((Unsubscribe) parse("unsubscribe")).getChannels()).isEmpty();
        assertThat(((Unsubscribe) parse("unsubscribe", "a")).getChannels()).containsExactly("a");
        assertThat(CommandType.SUBSCRIBE.isAllowedWhileSubscribed()).isTrue();
        assertThat(CommandType.GET.isAllowedWhileSubscribed()).isFalse();
    }
}
