package site.tinyredis.server;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletionStage;

/**
 * 服务器生命周期
 */
public interface RedisServer {

    /**
     * 绑定监听地址并开始接受连接
     */
    void start() throws InterruptedException;

    /**
     * 运行直到关闭触发器完成或accept持续失败，然后优雅关闭
     *
     * @param shutdownTrigger 完成即开始关闭，不关心结果
     * @throws Exception accept持续失败时抛出最后一次的异常
     */
    void run(CompletionStage<?> shutdownTrigger) throws Exception;

    /**
     * 停止接受新连接，等待已有连接全部退出后释放资源
     */
    void stop();

    InetSocketAddress getLocalAddress();
}
