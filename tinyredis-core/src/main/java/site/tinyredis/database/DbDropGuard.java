package site.tinyredis.database;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Db}的所有者守卫
 *
 * <p>服务器启动时创建一次，通过{@link #db()}向各连接分发共享的数据库句柄。
 * 关闭守卫时通知后台清理线程退出，而不是让它永远休眠。
 */
@Slf4j
public class DbDropGuard implements AutoCloseable {

    private final Db db;

    private final AtomicBoolean closed = new AtomicBoolean();

    public DbDropGuard() {
        this.db = new Db();
    }

    public Db db() {
        return db;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("关闭数据库，通知过期清理线程退出");
            db.shutdownPurgeTask();
        }
    }
}
