package common.metrics;

import java.time.Duration;

public final class NoopMetricsSink implements MetricsSink {
    public static final NoopMetricsSink INSTANCE = new NoopMetricsSink();

    private NoopMetricsSink() {}

    @Override
    public void incCounter(String name, long delta) {
    }

    @Override
    public void observeDuration(String name, Duration duration) {
    }
}
