package common.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 测试用时钟，只在显式推进时前进
 */
public final class ManualClock extends Clock {

    private volatile Instant now;
    private final AtomicReference<Runnable> nextReadHook = new AtomicReference<>();

    public ManualClock() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public ManualClock(Instant start) {
        this.now = start;
    }

    public void advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot move clock backwards");
        }
        now = now.plus(duration);
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    /**
     * 下一次读取时间时先执行一次给定动作，用于在被测代码的两步操作之间插入事件
     */
    public void onNextRead(Runnable action) {
        nextReadHook.set(action);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        Runnable hook = nextReadHook.getAndSet(null);
        if (hook != null) {
            hook.run();
        }
        return now;
    }
}
