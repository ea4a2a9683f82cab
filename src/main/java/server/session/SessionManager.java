package server.session;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import common.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.auth.AuthenticationException;
import server.auth.Authenticator;
import server.config.ServerConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 会话管理器
 *
 * <p>维护三张索引：会话ID、连接ID、玩家ID，三者在同一把写锁下同步修改。
 * 同一玩家任意时刻最多只绑定一个会话，新会话绑定时旧会话被强制顶下线。
 * 后台清理任务按固定间隔扫描空闲会话。</p>
 */
public class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, Session> sessions = new HashMap<>();
    private final Map<String, String> connectionIndex = new HashMap<>();
    private final Map<String, String> playerIndex = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Consumer<Session>> evictionListeners = new CopyOnWriteArrayList<>();

    private final Authenticator authenticator;
    private final Clock clock;
    private final MetricsSink metrics;
    private final Duration idleTimeout;
    private final Duration idleGracePeriod;
    private final Duration sweepInterval;

    private final AtomicLong sessionsCreated = new AtomicLong();
    private final AtomicLong sessionsRemoved = new AtomicLong();
    private final AtomicLong sessionsEvicted = new AtomicLong();
    private final AtomicLong sessionsReplaced = new AtomicLong();

    private ScheduledExecutorService scheduler;

    public SessionManager(ServerConfig config, Authenticator authenticator, Clock clock, MetricsSink metrics) {
        this.authenticator = authenticator;
        this.clock = clock;
        this.metrics = metrics;
        this.idleTimeout = config.getSessionIdleTimeout();
        this.idleGracePeriod = config.getSessionIdleGracePeriod();
        this.sweepInterval = config.getSessionSweepInterval();
    }

    /**
     * 为新连接创建会话，初始状态为 NEW
     *
     * @throws IllegalStateException 会话ID已存在，或该连接已经有会话
     */
    public Session createSession(String sessionId, String connectionId) {
        Session session = new Session(sessionId, connectionId, idleTimeout, clock);
        lock.writeLock().lock();
        try {
            if (sessions.containsKey(sessionId)) {
                throw new IllegalStateException("session " + sessionId + " already exists");
            }
            String existing = connectionIndex.get(connectionId);
            if (existing != null) {
                throw new IllegalStateException("connection " + connectionId + " already bound to session " + existing);
            }
            sessions.put(sessionId, session);
            connectionIndex.put(connectionId, sessionId);
        } finally {
            lock.writeLock().unlock();
        }
        sessionsCreated.incrementAndGet();
        metrics.incCounter("session.created");
        logger.debug("会话已创建: {}, 连接: {}", sessionId, connectionId);
        return session;
    }

    public Optional<Session> getSession(String sessionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Session> getSessionByConnection(String connectionId) {
        lock.readLock().lock();
        try {
            String sessionId = connectionIndex.get(connectionId);
            return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Session> getSessionByPlayer(String playerId) {
        lock.readLock().lock();
        try {
            String sessionId = playerIndex.get(playerId);
            return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 把玩家绑定到会话。玩家已绑定在另一个会话上时，旧会话被置为 DISCONNECTING 并解绑。
     *
     * @return 被顶替的旧会话，没有时为空
     * @throws SessionNotFoundException 会话不存在
     */
    public Optional<Session> bindPlayerToSession(String sessionId, String playerId) {
        Session displaced = null;
        lock.writeLock().lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null) {
                throw new SessionNotFoundException(sessionId);
            }
            String existingId = playerIndex.get(playerId);
            if (sessionId.equals(existingId)) {
                return Optional.empty();
            }
            if (existingId != null) {
                displaced = sessions.get(existingId);
                if (displaced != null) {
                    if (!displaced.getState().isTerminal()) {
                        displaced.transitionTo(SessionState.DISCONNECTING);
                    }
                    displaced.setPlayerId(null);
                }
            }
            String oldPlayer = session.getPlayerId();
            if (oldPlayer != null && !oldPlayer.equals(playerId) && sessionId.equals(playerIndex.get(oldPlayer))) {
                playerIndex.remove(oldPlayer);
            }
            playerIndex.put(playerId, sessionId);
            session.setPlayerId(playerId);
        } finally {
            lock.writeLock().unlock();
        }

        if (displaced != null) {
            sessionsReplaced.incrementAndGet();
            metrics.incCounter("session.replaced");
            logger.warn("玩家 {} 在新会话 {} 登录，旧会话 {} 被强制下线", playerId, sessionId, displaced.getId());
        } else {
            logger.info("玩家 {} 绑定到会话 {}", playerId, sessionId);
        }
        return Optional.ofNullable(displaced);
    }

    /**
     * 校验凭证，会话进入 AUTHENTICATED 并绑定玩家
     *
     * @throws SessionNotFoundException 会话不存在
     * @throws IllegalSessionStateException 会话当前状态不允许认证
     * @throws AuthenticationException 凭证校验失败
     */
    public AuthenticationResult authenticate(String sessionId, String credential) throws AuthenticationException {
        Session session = getSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        String playerId;
        try {
            playerId = authenticator.verify(credential);
        } catch (AuthenticationException e) {
            metrics.incCounter("session.auth_failed");
            logger.warn("会话 {} 认证失败: {}", sessionId, e.getMessage());
            throw e;
        }
        session.transitionTo(SessionState.AUTHENTICATED);
        Optional<Session> displaced = bindPlayerToSession(sessionId, playerId);
        metrics.incCounter("session.authenticated");
        logger.info("会话 {} 认证成功, 玩家: {}", sessionId, playerId);
        return new AuthenticationResult(session, playerId, displaced.orElse(null));
    }

    /**
     * 解除玩家绑定，会话本身保留
     */
    public void unbindPlayer(String playerId) {
        lock.writeLock().lock();
        try {
            String sessionId = playerIndex.remove(playerId);
            if (sessionId == null) {
                return;
            }
            Session session = sessions.get(sessionId);
            if (session != null) {
                session.setPlayerId(null);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("玩家 {} 已解除会话绑定", playerId);
    }

    /**
     * 移除会话，解绑玩家并标记为 DISCONNECTED。重复调用无副作用。
     *
     * @return 本次调用是否真正移除了会话
     */
    public boolean removeSession(String sessionId) {
        Session removed;
        lock.writeLock().lock();
        try {
            removed = detach(sessionId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            return false;
        }
        finishRemoval(removed);
        return true;
    }

    /**
     * 条件满足时移除会话。条件在会话自身的写锁下判断，判断期间会话的活动更新被阻塞，
     * 判断成立后会话立即进入 DISCONNECTED。
     *
     * @return 本次调用是否真正移除了会话
     */
    public boolean removeSessionIf(String sessionId, Predicate<Session> condition) {
        Session removed;
        lock.writeLock().lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null || !session.disconnectIf(condition)) {
                return false;
            }
            removed = detach(sessionId);
        } finally {
            lock.writeLock().unlock();
        }
        finishRemoval(removed);
        return true;
    }

    public boolean removeSessionByConnection(String connectionId) {
        String sessionId;
        lock.readLock().lock();
        try {
            sessionId = connectionIndex.get(connectionId);
        } finally {
            lock.readLock().unlock();
        }
        return sessionId != null && removeSession(sessionId);
    }

    public List<Session> getAllSessions() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(sessions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Session> getActiveSessions() {
        List<Session> result = new ArrayList<>();
        for (Session session : getAllSessions()) {
            if (session.isActive()) {
                result.add(session);
            }
        }
        return result;
    }

    public int getSessionCount() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getActiveSessionCount() {
        return getActiveSessions().size();
    }

    public SessionStats getStats() {
        List<Session> snapshot = getAllSessions();
        Map<SessionState, Integer> stateCounts = new EnumMap<>(SessionState.class);
        int active = 0;
        for (Session session : snapshot) {
            SessionState state = session.getState();
            stateCounts.merge(state, 1, Integer::sum);
            if (state == SessionState.ACTIVE) {
                active++;
            }
        }
        int boundPlayers;
        lock.readLock().lock();
        try {
            boundPlayers = playerIndex.size();
        } finally {
            lock.readLock().unlock();
        }
        return SessionStats.builder()
                .totalSessions(snapshot.size())
                .activeSessions(active)
                .boundPlayers(boundPlayers)
                .sessionsCreated(sessionsCreated.get())
                .sessionsRemoved(sessionsRemoved.get())
                .sessionsEvicted(sessionsEvicted.get())
                .sessionsReplaced(sessionsReplaced.get())
                .stateCounts(stateCounts)
                .build();
    }

    /**
     * 注册会话被清理时的回调，服务端据此关闭底层连接
     */
    public void addEvictionListener(Consumer<Session> listener) {
        evictionListeners.add(listener);
    }

    /**
     * 扫描一次空闲会话。
     * 超过空闲超时的已认证会话标记为 IDLE；超过空闲超时加宽限期的会话，
     * 以及已处于断开流程中的会话，直接移除并通知清理回调。
     *
     * @return 本次移除的会话数
     */
    public int sweepIdleSessions() {
        List<Session> evicted = new ArrayList<>();
        int markedIdle = 0;
        for (Session session : getAllSessions()) {
            SessionState state = session.getState();
            Duration inactive = session.getInactiveDuration();
            Duration timeout = session.getIdleTimeout();
            boolean expired = inactive.compareTo(timeout.plus(idleGracePeriod)) > 0;

            if (state == SessionState.DISCONNECTING || state == SessionState.DISCONNECTED || expired) {
                // 快照之后可能又有新消息到达，移除前重新判断
                if (removeSessionIf(session.getId(), this::isEvictable)) {
                    evicted.add(session);
                }
            } else if (inactive.compareTo(timeout) > 0 && state.isAuthenticated() && state != SessionState.IDLE) {
                session.transitionTo(SessionState.IDLE);
                markedIdle++;
            }
        }

        for (Session session : evicted) {
            sessionsEvicted.incrementAndGet();
            fireEvicted(session);
        }
        if (!evicted.isEmpty() || markedIdle > 0) {
            metrics.incCounter("session.evicted", evicted.size());
            logger.info("空闲会话清理完成，移除 {} 个，标记空闲 {} 个，剩余 {} 个",
                    evicted.size(), markedIdle, getSessionCount());
        }
        return evicted.size();
    }

    public synchronized void start() {
        if (scheduler != null && !scheduler.isShutdown()) {
            logger.warn("会话清理任务已经在运行中");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("session-sweeper-%d")
                .setDaemon(true)
                .build());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                sweepIdleSessions();
            } catch (Exception e) {
                logger.error("清理空闲会话时发生异常: {}", e.getMessage(), e);
            }
        }, sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("会话清理任务已启动，间隔: {}ms，空闲超时: {}ms", sweepInterval.toMillis(), idleTimeout.toMillis());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            logger.info("会话清理任务已停止");
        } catch (InterruptedException e) {
            logger.error("停止会话清理任务时被中断", e);
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }

    // 调用方须持有写锁
    private Session detach(String sessionId) {
        Session removed = sessions.remove(sessionId);
        if (removed == null) {
            return null;
        }
        if (sessionId.equals(connectionIndex.get(removed.getConnectionId()))) {
            connectionIndex.remove(removed.getConnectionId());
        }
        String playerId = removed.getPlayerId();
        if (playerId != null && sessionId.equals(playerIndex.get(playerId))) {
            playerIndex.remove(playerId);
        }
        return removed;
    }

    private void finishRemoval(Session removed) {
        String playerId = removed.getPlayerId();
        removed.transitionTo(SessionState.DISCONNECTED);
        removed.setPlayerId(null);
        sessionsRemoved.incrementAndGet();
        metrics.incCounter("session.removed");
        logger.info("会话已移除: {}, 玩家: {}", removed.getId(), playerId);
    }

    private boolean isEvictable(Session session) {
        SessionState state = session.getState();
        if (state == SessionState.DISCONNECTING || state == SessionState.DISCONNECTED) {
            return true;
        }
        return session.getInactiveDuration().compareTo(session.getIdleTimeout().plus(idleGracePeriod)) > 0;
    }

    private void fireEvicted(Session session) {
        for (Consumer<Session> listener : evictionListeners) {
            try {
                listener.accept(session);
            } catch (Exception e) {
                logger.error("会话清理回调执行失败: {}", session.getId(), e);
            }
        }
    }
}
