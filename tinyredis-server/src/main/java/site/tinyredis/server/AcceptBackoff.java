package site.tinyredis.server;

import java.time.Duration;

/**
 * accept失败后的指数退避
 *
 * <p>等待时间从初始值开始每次翻倍，超过上限后{@link #next()}返回null，表示放弃。
 * 成功accept一次后{@link #reset()}回到初始值。
 */
public class AcceptBackoff {

    private final Duration initial;

    private final Duration max;

    private Duration current;

    public AcceptBackoff(final Duration initial, final Duration max) {
        this.initial = initial;
        this.max = max;
        this.current = initial;
    }

    /**
     * @return 下一次重试前的等待时间，超过上限时返回null
     */
    public Duration next() {
        if (current.compareTo(max) > 0) {
            return null;
        }
        final Duration delay = current;
        current = current.multipliedBy(2);
        return delay;
    }

    public void reset() {
        current = initial;
    }
}
