package site.tinyredis.server.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("服务器配置测试")
class ServerConfigTest {

    @Test
    @DisplayName("默认配置")
    void testDefaults() {
        final ServerConfig config = ServerConfig.defaultConfig();

        assertEquals("127.0.0.1", config.getHost());
        assertEquals(6379, config.getPort());
        assertEquals(256, config.getMaxConnections());
        assertEquals(Duration.ofSeconds(1), config.getInitialAcceptBackoff());
        assertEquals(Duration.ofSeconds(32), config.getMaxAcceptBackoff());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("非法配置校验失败")
    void testValidate() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().port(70000).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().maxConnections(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().workerThreadCount(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().host(" ").build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder()
                        .initialAcceptBackoff(Duration.ofSeconds(10))
                        .maxAcceptBackoff(Duration.ofSeconds(1))
                        .build().validate());
    }

    @Test
    @DisplayName("端口0表示由系统分配")
    void testEphemeralPort() {
        assertDoesNotThrow(() -> ServerConfig.builder().port(0).build().validate());
    }
}
