package site.tinyredis;

import lombok.extern.slf4j.Slf4j;
import site.tinyredis.server.RedisServer;
import site.tinyredis.server.TinyRedisServer;
import site.tinyredis.server.config.ServerConfig;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

/**
 * 服务器命令行入口
 *
 * <pre>
 * tinyredis-server [--host &lt;host&gt;] [--port &lt;port&gt;]
 * </pre>
 *
 * <p>进程收到SIGINT/SIGTERM时开始优雅关闭，等所有连接退出后进程才结束。
 */
@Slf4j
public class TinyRedisServerLauncher {

    static final String USAGE = "Usage: tinyredis-server [--host <host>] [--port <port>]";

    public static void main(String[] args) {
        final ServerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        final RedisServer redisServer = new TinyRedisServer(config);
        final CompletableFuture<Void> shutdownTrigger = new CompletableFuture<>();
        final CountDownLatch finished = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            shutdownTrigger.complete(null);
            try {
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "tinyredis-shutdown-hook"));

        int exitCode = 0;
        try {
            redisServer.run(shutdownTrigger);
            log.info("服务器已安全关闭");
        } catch (Exception e) {
            log.error("服务器异常退出", e);
            exitCode = 1;
        } finally {
            finished.countDown();
        }

        // 由关闭钩子触发时JVM已在退出，不能再调用System.exit
        if (exitCode != 0 && !shutdownTrigger.isDone()) {
            System.exit(exitCode);
        }
    }

    /**
     * 解析命令行参数
     *
     * @throws IllegalArgumentException 参数无法识别或取值非法
     */
    static ServerConfig parseArgs(final String[] args) {
        final ServerConfig.ServerConfigBuilder builder = ServerConfig.builder();
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            switch (arg) {
                case "--port":
                    builder.port(parsePort(requireValue(args, ++i, arg)));
                    break;
                case "--host":
                    builder.host(requireValue(args, ++i, arg));
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + arg);
            }
        }
        final ServerConfig config = builder.build();
        config.validate();
        return config;
    }

    private static String requireValue(final String[] args, final int index, final String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("参数 " + option + " 缺少取值");
        }
        return args[index];
    }

    private static int parsePort(final String value) {
        final int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("端口号不是数字: " + value, e);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在1-65535范围内: " + value);
        }
        return port;
    }
}
