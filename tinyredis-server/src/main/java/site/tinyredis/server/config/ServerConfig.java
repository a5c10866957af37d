package site.tinyredis.server.config;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * 服务器配置
 *
 * <p>所有字段都有默认值，{@link #defaultConfig()}即可直接启动。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Data
@Builder
public class ServerConfig {

    public static final int DEFAULT_PORT = 6379;

    public static final int DEFAULT_MAX_CONNECTIONS = 256;

    // ========== 网络配置 ==========

    @Builder.Default
    private String host = "127.0.0.1";

    /** 监听端口，0表示由系统分配 */
    @Builder.Default
    private int port = DEFAULT_PORT;

    @Builder.Default
    private int backlogSize = 1024;

    /** 同时服务的最大连接数，超出的连接在内核队列中等待 */
    @Builder.Default
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;

    // ========== 线程配置 ==========

    @Builder.Default
    private int bossThreadCount = 1;

    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /** 可用时使用epoll/kqueue，否则退回NIO */
    @Builder.Default
    private boolean nativeTransport = true;

    // ========== accept重试配置 ==========

    /** accept失败后的第一次等待时间，之后每次翻倍 */
    @Builder.Default
    private Duration initialAcceptBackoff = Duration.ofSeconds(1);

    /** 等待时间超过该值后放弃，服务器以错误退出 */
    @Builder.Default
    private Duration maxAcceptBackoff = Duration.ofSeconds(32);

    // ========== 工厂方法 ==========

    public static ServerConfig defaultConfig() {
        return ServerConfig.builder().build();
    }

    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (maxConnections <= 0) {
            throw new IllegalArgumentException("最大连接数必须大于0");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0) {
            throw new IllegalArgumentException("backlog必须大于0");
        }

        if (initialAcceptBackoff == null || maxAcceptBackoff == null
                || initialAcceptBackoff.isNegative() || initialAcceptBackoff.isZero()
                || maxAcceptBackoff.compareTo(initialAcceptBackoff) < 0) {
            throw new IllegalArgumentException("accept重试时间必须为正数，且上限不小于初始值");
        }
    }
}
