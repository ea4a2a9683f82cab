package server;

import common.metrics.MetricsSink;
import common.metrics.NoopMetricsSink;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.auth.Authenticator;
import server.config.ServerConfig;
import server.connection.ConnectionRegistry;
import server.handler.SystemHandlers;
import server.heartbeat.HeartbeatMonitor;
import server.router.Router;
import server.session.SessionManager;

import java.time.Clock;

/**
 * 网关核心组件的装配。
 *
 * <p>连接移除是唯一的清理入口：心跳超时、会话清理、客户端断开最终都走
 * {@link ConnectionRegistry#remove(String)}，再由移除回调同步到会话与心跳。</p>
 */
@Getter
public class GameGateway {
    private static final Logger logger = LoggerFactory.getLogger(GameGateway.class);

    private final ServerConfig config;
    private final Clock clock;
    private final MetricsSink metrics;
    private final ConnectionRegistry connectionRegistry;
    private final SessionManager sessionManager;
    private final HeartbeatMonitor heartbeatMonitor;
    private final Router router;

    public GameGateway(ServerConfig config, Authenticator authenticator) {
        this(config, authenticator, Clock.systemUTC(), NoopMetricsSink.INSTANCE);
    }

    public GameGateway(ServerConfig config, Authenticator authenticator, Clock clock, MetricsSink metrics) {
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
        this.connectionRegistry = new ConnectionRegistry(config, clock, metrics);
        this.sessionManager = new SessionManager(config, authenticator, clock, metrics);
        this.heartbeatMonitor = new HeartbeatMonitor(config, clock, metrics);
        this.router = new Router(config, metrics);

        connectionRegistry.addRemovalListener(connection -> {
            sessionManager.removeSessionByConnection(connection.getId());
            heartbeatMonitor.untrack(connection.getId());
        });
        heartbeatMonitor.addDisconnectListener(connectionRegistry::remove);
        sessionManager.addEvictionListener(session -> connectionRegistry.remove(session.getConnectionId()));

        SystemHandlers.register(router, sessionManager, connectionRegistry, heartbeatMonitor);
    }

    /**
     * 启动后台任务：连接清理、会话清理、心跳检查
     */
    public void start() {
        connectionRegistry.start();
        sessionManager.start();
        heartbeatMonitor.start();
        logger.info("网关核心已启动: {}", config);
    }

    public void stop() {
        heartbeatMonitor.stop();
        sessionManager.stop();
        connectionRegistry.stop();
        connectionRegistry.closeAll();
        logger.info("网关核心已停止, 连接统计: {}", connectionRegistry.getStats());
    }
}
