package common.metrics;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 进程内指标汇总，用于本地调试和测试
 */
public class InMemoryMetricsSink implements MetricsSink {
    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> durationCounts = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> durationNanos = new ConcurrentHashMap<>();

    @Override
    public void incCounter(String name, long delta) {
        counters.computeIfAbsent(name, k -> new LongAdder()).add(delta);
    }

    @Override
    public void observeDuration(String name, Duration duration) {
        durationCounts.computeIfAbsent(name, k -> new LongAdder()).increment();
        durationNanos.computeIfAbsent(name, k -> new LongAdder()).add(duration.toNanos());
    }

    public long getCounter(String name) {
        LongAdder adder = counters.get(name);
        return adder != null ? adder.sum() : 0L;
    }

    public long getObservationCount(String name) {
        LongAdder adder = durationCounts.get(name);
        return adder != null ? adder.sum() : 0L;
    }

    // 平均耗时，无观测值时返回 Duration.ZERO
    public Duration getAverageDuration(String name) {
        long count = getObservationCount(name);
        if (count == 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(durationNanos.get(name).sum() / count);
    }

    public Map<String, Long> snapshotCounters() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((name, adder) -> snapshot.put(name, adder.sum()));
        return snapshot;
    }

    public void clear() {
        counters.clear();
        durationCounts.clear();
        durationNanos.clear();
    }
}
