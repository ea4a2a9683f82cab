package server.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * 玩家会话，与一条连接一一对应，认证后绑定玩家。
 *
 * <p>状态、时间戳与会话数据都由会话自身的读写锁保护。</p>
 */
public class Session {
    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private final String id;
    private final String connectionId;
    private final Instant createdAt;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Object> sessionData = new HashMap<>();

    private String playerId;
    private SessionState state = SessionState.NEW;
    private Instant lastActivity;
    private Instant authTime;
    private Duration idleTimeout;

    public Session(String id, String connectionId, Duration idleTimeout, Clock clock) {
        this.id = id;
        this.connectionId = connectionId;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * 迁移会话状态。
     *
     * @throws IllegalSessionStateException 会话已断开，或从 NEW/CONNECTED 以外的状态进入 AUTHENTICATED
     */
    public void transitionTo(SessionState target) {
        SessionState from;
        lock.writeLock().lock();
        try {
            from = state;
            if (from == target) {
                return;
            }
            if (from.isTerminal()) {
                throw new IllegalSessionStateException(id, from, target);
            }
            if (target == SessionState.AUTHENTICATED
                    && from != SessionState.NEW && from != SessionState.CONNECTED) {
                throw new IllegalSessionStateException(id, from, target);
            }
            state = target;
            if (target == SessionState.AUTHENTICATED) {
                authTime = clock.instant();
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("会话 {} 状态变更: {} -> {}", id, from, target);
    }

    /**
     * 记录一次活动。已认证或空闲的会话同时转为 ACTIVE
     */
    public void updateActivity() {
        lock.writeLock().lock();
        try {
            lastActivity = clock.instant();
            if (state == SessionState.AUTHENTICATED || state == SessionState.IDLE) {
                state = SessionState.ACTIVE;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 在写锁下判断条件，成立则直接进入 DISCONNECTED
     */
    boolean disconnectIf(Predicate<Session> condition) {
        SessionState from;
        lock.writeLock().lock();
        try {
            from = state;
            if (!condition.test(this)) {
                return false;
            }
            if (from == SessionState.DISCONNECTED) {
                return true;
            }
            state = SessionState.DISCONNECTED;
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("会话 {} 状态变更: {} -> {}", id, from, SessionState.DISCONNECTED);
        return true;
    }

    public SessionState getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getPlayerId() {
        lock.readLock().lock();
        try {
            return playerId;
        } finally {
            lock.readLock().unlock();
        }
    }

    void setPlayerId(String playerId) {
        lock.writeLock().lock();
        try {
            this.playerId = playerId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Instant getLastActivity() {
        lock.readLock().lock();
        try {
            return lastActivity;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getAuthTime() {
        lock.readLock().lock();
        try {
            return authTime;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration getIdleTimeout() {
        lock.readLock().lock();
        try {
            return idleTimeout;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setIdleTimeout(Duration idleTimeout) {
        lock.writeLock().lock();
        try {
            this.idleTimeout = idleTimeout;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isAuthenticated() {
        return getState().isAuthenticated();
    }

    public boolean isActive() {
        return getState() == SessionState.ACTIVE;
    }

    public boolean isIdle() {
        return getState() == SessionState.IDLE;
    }

    /**
     * 距最后一次活动已经过去的时间
     */
    public Duration getInactiveDuration() {
        return Duration.between(getLastActivity(), clock.instant());
    }

    public void setData(String key, Object value) {
        lock.writeLock().lock();
        try {
            sessionData.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T getData(String key) {
        lock.readLock().lock();
        try {
            return (T) sessionData.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Object removeData(String key) {
        lock.writeLock().lock();
        try {
            return sessionData.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return "Session{id=" + id + ", connection=" + connectionId
                    + ", player=" + playerId + ", state=" + state + "}";
        } finally {
            lock.readLock().unlock();
        }
    }
}
