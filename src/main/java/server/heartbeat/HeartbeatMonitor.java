package server.heartbeat;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import common.message.GameMessage;
import common.message.MessageFlags;
import common.message.MessageHeader;
import common.message.MessageType;
import common.message.ProtocolConstant;
import common.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.config.ServerConfig;
import server.connection.Connection;
import server.connection.ConnectionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 心跳监控器
 *
 * <p>所有连接共用一个定时线程：每次 tick 检查距上次收到回应的时间，
 * 超时记一次丢失，丢失次数达到上限即关闭连接并通知断开回调，否则发出一个 PING 探测。</p>
 */
public class HeartbeatMonitor {
    private static final Logger logger = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final Map<String, Tracked> tracked = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock scheduleLock = new ReentrantLock();
    private final List<Consumer<String>> disconnectListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger probeIds = new AtomicInteger();

    private final boolean enabled;
    private final Clock clock;
    private final MetricsSink metrics;

    private volatile Settings settings;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public HeartbeatMonitor(ServerConfig config, Clock clock, MetricsSink metrics) {
        this.enabled = config.isHeartbeatEnabled();
        this.clock = clock;
        this.metrics = metrics;
        this.settings = new Settings(config.getHeartbeatInterval(), config.getHeartbeatTimeout(),
                config.getHeartbeatMaxMissed());
    }

    /**
     * 开始监控连接。同一ID已在监控中时保留原有记录
     *
     * @return 是否新加入监控
     */
    public boolean track(Connection connection) {
        lock.writeLock().lock();
        try {
            if (tracked.containsKey(connection.getId())) {
                logger.warn("连接 {} 已在心跳监控中，忽略重复登记", connection.getId());
                return false;
            }
            tracked.put(connection.getId(), new Tracked(connection, new HeartbeatStatus(connection.getId(), clock.instant())));
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("开始监控连接心跳: {}", connection.getId());
        return true;
    }

    public void untrack(String connectionId) {
        Tracked removed;
        lock.writeLock().lock();
        try {
            removed = tracked.remove(connectionId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            logger.debug("停止监控连接心跳: {}", connectionId);
        }
    }

    public Optional<HeartbeatStatus> getStatus(String connectionId) {
        lock.readLock().lock();
        try {
            Tracked t = tracked.get(connectionId);
            return t == null ? Optional.empty() : Optional.of(t.status.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getTrackedCount() {
        lock.readLock().lock();
        try {
            return tracked.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 收到 PONG 回应，同时计算往返时间。未被监控的连接直接忽略
     */
    public void onProbeReply(String connectionId) {
        markReceived(connectionId, true);
    }

    /**
     * 客户端主动发来的 HEARTBEAT 同样证明连接存活，但不更新往返时间
     */
    public void onHeartbeat(String connectionId) {
        markReceived(connectionId, false);
    }

    public void addDisconnectListener(Consumer<String> listener) {
        disconnectListeners.add(listener);
    }

    /**
     * 执行一轮心跳检查。正常由定时线程调用，也可由外部直接驱动
     */
    public void tick() {
        Settings current = settings;
        Instant now = clock.instant();
        List<Connection> toEvict = new ArrayList<>();
        List<Connection> toProbe = new ArrayList<>();

        lock.writeLock().lock();
        try {
            for (Tracked t : new ArrayList<>(tracked.values())) {
                HeartbeatStatus status = t.status;
                Duration elapsed = Duration.between(status.getLastReceived(), now);
                if (elapsed.compareTo(current.timeout) > 0) {
                    status.markMissed();
                    logger.debug("连接 {} 心跳超时 {}ms, 已丢失 {} 次", t.connection.getId(),
                            elapsed.toMillis(), status.getMissedCount());
                }
                if (status.getMissedCount() >= current.maxMissed) {
                    tracked.remove(t.connection.getId());
                    toEvict.add(t.connection);
                } else {
                    status.markSent(now);
                    toProbe.add(t.connection);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (Connection connection : toProbe) {
            try {
                connection.send(probe(connection, now));
                metrics.incCounter("heartbeat.probe_sent");
            } catch (ConnectionException e) {
                logger.warn("向连接 {} 发送心跳探测失败: {}", connection.getId(), e.getMessage());
                untrack(connection.getId());
                toEvict.add(connection);
            }
        }
        for (Connection connection : toEvict) {
            evict(connection);
        }
    }

    public void start() {
        if (!enabled) {
            logger.info("心跳监控未启用");
            return;
        }
        scheduleLock.lock();
        try {
            if (scheduler != null) {
                logger.warn("心跳监控已经在运行中");
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                    .setNameFormat("heartbeat-monitor-%d")
                    .setDaemon(true)
                    .build());
            schedule(settings);
        } finally {
            scheduleLock.unlock();
        }
    }

    public void stop() {
        scheduleLock.lock();
        try {
            if (scheduler == null) {
                return;
            }
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
            tickTask = null;
            logger.info("心跳监控已停止");
        } finally {
            scheduleLock.unlock();
        }
    }

    /**
     * 运行时调整心跳参数。正在执行的 tick 使用旧参数完成，之后的 tick 使用新参数
     */
    public void reconfigure(Duration interval, Duration timeout, int maxMissed) {
        if (interval.isZero() || interval.isNegative() || maxMissed <= 0) {
            throw new IllegalArgumentException("invalid heartbeat settings: interval=" + interval + ", maxMissed=" + maxMissed);
        }
        scheduleLock.lock();
        try {
            Settings next = new Settings(interval, timeout, maxMissed);
            settings = next;
            if (tickTask != null) {
                tickTask.cancel(false);
                schedule(next);
            }
            logger.info("心跳参数已更新: 间隔 {}ms, 超时 {}ms, 最大丢失 {}", interval.toMillis(), timeout.toMillis(), maxMissed);
        } finally {
            scheduleLock.unlock();
        }
    }

    public Duration getInterval() {
        return settings.interval;
    }

    public Duration getTimeout() {
        return settings.timeout;
    }

    public int getMaxMissed() {
        return settings.maxMissed;
    }

    private void schedule(Settings s) {
        long period = s.interval.toMillis();
        tickTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                tick();
            } catch (Exception e) {
                logger.error("心跳检查时发生异常: {}", e.getMessage(), e);
            }
        }, period, period, TimeUnit.MILLISECONDS);
        logger.info("心跳监控已启动，间隔: {}ms，超时: {}ms，最大丢失: {}", period, s.timeout.toMillis(), s.maxMissed);
    }

    private void markReceived(String connectionId, boolean measureRtt) {
        lock.writeLock().lock();
        try {
            Tracked t = tracked.get(connectionId);
            if (t != null) {
                t.status.markReceived(clock.instant(), measureRtt);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private GameMessage probe(Connection connection, Instant now) {
        MessageHeader header = MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(probeIds.incrementAndGet())
                .messageType(MessageType.PING)
                .flags(MessageFlags.REQUEST)
                .timestamp(now.toEpochMilli())
                .sequence(connection.nextSequence())
                .build();
        return GameMessage.of(header, new byte[0]);
    }

    private void evict(Connection connection) {
        logger.warn("连接 {} 心跳丢失次数达到上限，关闭连接", connection.getId());
        metrics.incCounter("heartbeat.evicted");
        connection.close();
        for (Consumer<String> listener : disconnectListeners) {
            try {
                listener.accept(connection.getId());
            } catch (Exception e) {
                logger.error("心跳断开回调执行失败: {}", connection.getId(), e);
            }
        }
    }

    private static final class Tracked {
        private final Connection connection;
        private final HeartbeatStatus status;

        private Tracked(Connection connection, HeartbeatStatus status) {
            this.connection = connection;
            this.status = status;
        }
    }

    private static final class Settings {
        private final Duration interval;
        private final Duration timeout;
        private final int maxMissed;

        private Settings(Duration interval, Duration timeout, int maxMissed) {
            this.interval = interval;
            this.timeout = timeout;
            this.maxMissed = maxMissed;
        }
    }
}
