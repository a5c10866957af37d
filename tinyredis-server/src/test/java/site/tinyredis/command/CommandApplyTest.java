package site.tinyredis.command;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import site.tinyredis.command.impl.Get;
import site.tinyredis.command.impl.Publish;
import site.tinyredis.command.impl.Set;
import site.tinyredis.command.impl.Unknown;
import site.tinyredis.command.impl.Unsubscribe;
import site.tinyredis.database.Db;
import site.tinyredis.database.DbDropGuard;
import site.tinyredis.protocol.BulkString;
import site.tinyredis.protocol.ErrorFrame;
import site.tinyredis.protocol.IntegerFrame;
import site.tinyredis.protocol.NullFrame;
import site.tinyredis.protocol.SimpleString;
import site.tinyredis.server.handler.Connection;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("命令执行测试")
class CommandApplyTest {

    @Mock
    private Connection connection;

    private AutoCloseable mocks;

    private DbDropGuard guard;

    private Db db;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        guard = new DbDropGuard();
        db = guard.db();
    }

    @AfterEach
    void tearDown() throws Exception {
        guard.close();
        mocks.close();
    }

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("SET写入数据库并回复OK")
    void testSet() throws Exception {
        new Set("hello", bytes("world"), Duration.ofSeconds(60)).apply(db, connection);

        verify(connection).writeFrame(SimpleString.OK);
        assertArrayEquals(bytes("world"), db.get("hello"));
    }

    @Test
    @DisplayName("GET存在的键回复批量字符串")
    void testGetExisting() throws Exception {
        db.set("hello", bytes("world"), null);

        new Get("hello").apply(db, connection);

        verify(connection).writeFrame(BulkString.fromString("world"));
    }

    @Test
    @DisplayName("GET不存在的键回复空值")
    void testGetMissing() throws Exception {
        new Get("missing").apply(db, connection);

        verify(connection).writeFrame(NullFrame.INSTANCE);
    }

    @Test
    @DisplayName("PUBLISH回复订阅者数量")
    void testPublish() throws Exception {
        db.subscribe("news", message -> { });

        new Publish("news", bytes("hi")).apply(db, connection);
        new Publish("empty", bytes("hi")).apply(db, connection);

        verify(connection).writeFrame(IntegerFrame.valueOf(1));
        verify(connection).writeFrame(IntegerFrame.valueOf(0));
    }

    @Test
    @DisplayName("未识别的命令回复带命令名的错误")
    void testUnknown() throws Exception {
        new Unknown("foo").apply(db, connection);

        verify(connection).writeFrame(argThat(frame -> frame instanceof ErrorFrame
                && ((ErrorFrame) frame).getContent().equals("ERR unknown command 'foo'")));
    }

    @Test
    @DisplayName("非订阅模式下UNSUBSCRIBE是致命错误")
    void testUnsubscribeOutsideSubscriptionMode() {
        when(connection.isSubscribed()).thenReturn(false);

        final CommandException e = assertThrows(CommandException.class,
                () -> new Unsubscribe(Collections.emptyList()).apply(db, connection));

        assertTrue(e.isFatal());
        verify(connection, never()).writeFrame(any());
    }
}
