package common.metrics;

import java.time.Duration;

/**
 * 指标上报接口。实现必须是非阻塞的，调用方不关心上报结果。
 */
public interface MetricsSink {

    void incCounter(String name, long delta);

    void observeDuration(String name, Duration duration);

    default void incCounter(String name) {
        incCounter(name, 1);
    }
}
