package server.connection;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import common.message.GameMessage;
import common.message.MessageFlags;
import common.metrics.MetricsSink;
import server.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 连接注册表，维护所有存活连接及其分组。
 *
 * <p>连接表与分组表由同一把读写锁保护；广播、关闭连接和移除回调都在锁外执行。
 * 连接被移除时依次通知所有移除监听器（会话管理、心跳监控），保证几个结构不会长期分叉。</p>
 */
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Connection> connections = new HashMap<>();
    private final Map<String, Set<String>> groups = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Consumer<Connection>> removalListeners = new CopyOnWriteArrayList<>();

    private final int maxConnections;
    private final Duration cleanupInterval;
    private final Duration inactiveTimeout;
    private final Clock clock;
    private final MetricsSink metrics;

    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong peakConnections = new AtomicLong();
    private final AtomicLong connectionsRejected = new AtomicLong();
    private final AtomicLong connectionsClosed = new AtomicLong();

    private ScheduledExecutorService scheduler;

    public ConnectionRegistry(ServerConfig config, Clock clock, MetricsSink metrics) {
        this.maxConnections = config.getMaxConnections();
        this.cleanupInterval = config.getConnectionCleanupInterval();
        this.inactiveTimeout = config.getConnectionInactiveTimeout();
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * 注册新连接
     *
     * @return 超过最大连接数或ID已被占用时返回 false，连接不会被登记，由调用方关闭
     */
    public boolean add(Connection connection) {
        int size;
        lock.writeLock().lock();
        try {
            if (connections.size() >= maxConnections) {
                connectionsRejected.incrementAndGet();
                metrics.incCounter("connection.rejected");
                logger.warn("连接数已达上限 {}，拒绝连接 {}", maxConnections, connection.getRemoteAddress());
                return false;
            }
            if (connections.putIfAbsent(connection.getId(), connection) != null) {
                connectionsRejected.incrementAndGet();
                metrics.incCounter("connection.rejected");
                logger.error("连接ID {} 已被占用，拒绝连接 {}", connection.getId(), connection.getRemoteAddress());
                return false;
            }
            size = connections.size();
        } finally {
            lock.writeLock().unlock();
        }

        totalConnections.incrementAndGet();
        peakConnections.accumulateAndGet(size, Math::max);
        metrics.incCounter("connection.accepted");
        logger.info("连接已注册: {} ({}), 当前连接数: {}", connection.getId(), connection.getRemoteAddress(), size);
        return true;
    }

    /**
     * 移除并关闭连接，然后通知移除监听器。对不存在的ID调用是空操作。
     *
     * @return 本次调用是否真正移除了连接
     */
    public boolean remove(String connectionId) {
        Connection removed;
        lock.writeLock().lock();
        try {
            removed = connections.remove(connectionId);
            if (removed == null) {
                return false;
            }
            for (String groupId : removed.getGroups()) {
                Set<String> members = groups.get(groupId);
                if (members != null) {
                    members.remove(connectionId);
                    if (members.isEmpty()) {
                        groups.remove(groupId);
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        removed.close();
        connectionsClosed.incrementAndGet();
        metrics.incCounter("connection.closed");
        logger.info("连接已移除: {}", connectionId);
        fireRemoved(removed);
        return true;
    }

    public Optional<Connection> get(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Connection> getAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean joinGroup(String connectionId, String groupId) {
        lock.writeLock().lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection == null) {
                return false;
            }
            groups.computeIfAbsent(groupId, k -> new HashSet<>()).add(connectionId);
            connection.addGroup(groupId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void leaveGroup(String connectionId, String groupId) {
        lock.writeLock().lock();
        try {
            Set<String> members = groups.get(groupId);
            if (members != null) {
                members.remove(connectionId);
                if (members.isEmpty()) {
                    groups.remove(groupId);
                }
            }
            Connection connection = connections.get(connectionId);
            if (connection != null) {
                connection.removeGroup(groupId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Connection> getGroupMembers(String groupId) {
        lock.readLock().lock();
        try {
            Set<String> members = groups.get(groupId);
            if (members == null) {
                return Collections.emptyList();
            }
            List<Connection> result = new ArrayList<>(members.size());
            for (String id : members) {
                Connection connection = connections.get(id);
                if (connection != null) {
                    result.add(connection);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 向所有连接广播
     *
     * @return 成功投递的连接数
     */
    public int broadcast(GameMessage message) {
        return deliver(getAll(), message, "all");
    }

    public int broadcastToGroup(String groupId, GameMessage message) {
        return deliver(getGroupMembers(groupId), message, groupId);
    }

    /**
     * 移除最后活跃时间早于 timeout 的连接
     *
     * @return 被清理的连接数
     */
    public int cleanupInactive(Duration timeout) {
        Instant deadline = clock.instant().minus(timeout);
        List<String> expired = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Connection connection : connections.values()) {
                if (connection.getLastActivity().isBefore(deadline)) {
                    expired.add(connection.getId());
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        int removed = 0;
        for (String connectionId : expired) {
            if (remove(connectionId)) {
                logger.warn("连接 {} 超过 {}ms 无活动，已清理", connectionId, timeout.toMillis());
                removed++;
            }
        }
        if (removed > 0) {
            metrics.incCounter("connection.inactive_removed", removed);
            logger.info("非活跃连接清理完成，移除 {} 个，剩余 {} 个", removed, size());
        }
        return removed;
    }

    public void addRemovalListener(Consumer<Connection> listener) {
        removalListeners.add(listener);
    }

    /**
     * 启动后台清理任务，按 cleanupInterval 周期清理超过 inactiveTimeout 无活动的连接
     */
    public synchronized void start() {
        if (scheduler != null && !scheduler.isShutdown()) {
            logger.warn("连接清理任务已经在运行中");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("connection-cleanup-%d")
                .setDaemon(true)
                .build());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                cleanupInactive(inactiveTimeout);
            } catch (Exception e) {
                logger.error("清理非活跃连接时发生异常: {}", e.getMessage(), e);
            }
        }, cleanupInterval.toMillis(), cleanupInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("连接清理任务已启动，间隔: {}ms，超时: {}ms", cleanupInterval.toMillis(), inactiveTimeout.toMillis());
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            logger.info("连接清理任务已停止");
        }
    }

    /**
     * 关闭并移除所有连接，用于停机
     */
    public void closeAll() {
        for (Connection connection : getAll()) {
            remove(connection.getId());
        }
    }

    public ConnectionStats getStats() {
        return ConnectionStats.builder()
                .totalConnections(totalConnections.get())
                .activeConnections(size())
                .peakConnections(peakConnections.get())
                .connectionsAccepted(totalConnections.get())
                .connectionsRejected(connectionsRejected.get())
                .connectionsClosed(connectionsClosed.get())
                .build();
    }

    private int deliver(List<Connection> targets, GameMessage message, String scope) {
        GameMessage broadcast = new GameMessage(
                message.getHeader().toBuilder()
                        .flags(MessageFlags.set(message.getHeader().getFlags(), MessageFlags.BROADCAST))
                        .build(),
                message.getPayload());
        int success = 0;
        for (Connection connection : targets) {
            try {
                connection.send(broadcast);
                success++;
            } catch (ConnectionException e) {
                metrics.incCounter("connection.broadcast_failed");
                logger.warn("广播到连接 {} 失败: {}", connection.getId(), e.getMessage());
            }
        }
        logger.debug("广播完成, 范围: {}, type={}, 目标: {}, 成功: {}",
                scope, message.getMessageType(), targets.size(), success);
        return success;
    }

    private void fireRemoved(Connection connection) {
        for (Consumer<Connection> listener : removalListeners) {
            try {
                listener.accept(connection);
            } catch (Exception e) {
                logger.error("连接移除回调执行失败: {}", connection.getId(), e);
            }
        }
    }
}
