package site.tinyredis.pubsub;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.tinyredis.database.Db;
import site.tinyredis.database.DbDropGuard;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("发布订阅测试")
class PubSubTest {

    private DbDropGuard guard;
    private Db db;

    @BeforeEach
    void setUp() {
        guard = new DbDropGuard();
        db = guard.db();
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("无人订阅的频道发布返回0")
    void testPublishWithoutSubscribers() {
        assertThat(db.publish("nobody", bytes("hi"))).isZero();
        assertThat(db.channelCount()).isZero();
    }

    @Test
    @DisplayName("消息扇出给频道上的全部订阅者")
    void testFanOut() {
        List<Message> first = new CopyOnWriteArrayList<>();
        List<Message> second = new CopyOnWriteArrayList<>();
        List<Message> other = new CopyOnWriteArrayList<>();
        db.subscribe("news", first::add);
        db.subscribe("news", second::add);
        db.subscribe("sports", other::add);

        int receivers = db.publish("news", bytes("hello"));

        assertThat(receivers).isEqualTo(2);
        assertThat(first).hasSize(1);
        assertThat(first.get(0).getChannel()).isEqualTo("news");
        assertThat(first.get(0).getPayload()).isEqualTo(bytes("hello"));
        assertThat(second).hasSize(1);
        assertThat(other).isEmpty();
    }

    @Test
    @DisplayName("退订后不再接收，最后一个订阅者离开时频道被移除")
    void testUnsubscribeRemovesEmptyChannel() {
        List<Message> received = new CopyOnWriteArrayList<>();
        Subscription a = db.subscribe("news", received::add);
        Subscription b = db.subscribe("news", received::add);
        assertThat(db.channelCount()).isEqualTo(1);

        a.close();
        assertThat(db.publish("news", bytes("1"))).isEqualTo(1);
        assertThat(db.channelCount()).isEqualTo(1);

        b.close();
        b.close();
        assertThat(a.isClosed()).isTrue();
        assertThat(db.publish("news", bytes("2"))).isZero();
        assertThat(db.channelCount()).isZero();
        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("单个订阅者回调失败不影响其他订阅者")
    void testFailingListenerIsolated() {
        List<Message> received = new CopyOnWriteArrayList<>();
        db.subscribe("news", message -> {
            throw new IllegalStateException("boom");
        });
        db.subscribe("news", received::add);

        assertThat(db.publish("news", bytes("x"))).isEqualTo(2);
        assertThat(received).hasSize(1);
    }
}
