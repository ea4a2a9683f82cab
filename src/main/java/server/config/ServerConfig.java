package server.config;

import common.message.ProtocolConstant;
import common.util.AppConfig;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 网关服务配置。通过 {@link #load()} 从系统属性和 application.properties 构建，
 * 以构造参数的方式注入各组件。
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class ServerConfig {

    @Builder.Default
    private final String host = "0.0.0.0";
    @Builder.Default
    private final int port = 9090;
    @Builder.Default
    private final int maxConnections = 10000;
    @Builder.Default
    private final int maxFrameSize = ProtocolConstant.DEFAULT_MAX_FRAME_SIZE;
    @Builder.Default
    private final int bossThreads = 1;
    // 0 表示使用 Netty 默认值（CPU 核数 * 2）
    @Builder.Default
    private final int workerThreads = 0;
    @Builder.Default
    private final int businessThreads = 16;

    // 单连接未刷出的写请求上限，超过即视为客户端跟不上
    @Builder.Default
    private final int outboundQueueCapacity = 100;
    @Builder.Default
    private final Duration connectionInactiveTimeout = Duration.ofMinutes(5);
    @Builder.Default
    private final Duration connectionCleanupInterval = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration sessionIdleTimeout = Duration.ofMinutes(30);
    @Builder.Default
    private final Duration sessionIdleGracePeriod = Duration.ZERO;
    @Builder.Default
    private final Duration sessionSweepInterval = Duration.ofMinutes(5);

    @Builder.Default
    private final boolean heartbeatEnabled = true;
    @Builder.Default
    private final Duration heartbeatInterval = Duration.ofSeconds(30);
    @Builder.Default
    private final Duration heartbeatTimeout = Duration.ofSeconds(10);
    @Builder.Default
    private final int heartbeatMaxMissed = 3;

    // 非系统消息是否要求会话已认证
    @Builder.Default
    private final boolean requireAuthentication = true;

    public static ServerConfig defaults() {
        return ServerConfig.builder().build();
    }

    public static ServerConfig load() {
        ServerConfig d = defaults();
        return ServerConfig.builder()
                .host(AppConfig.getString("game.server.host", d.host))
                .port(AppConfig.getInt("game.server.port", d.port))
                .maxConnections(AppConfig.getInt("game.server.max-connections", d.maxConnections))
                .maxFrameSize(AppConfig.getInt("game.server.max-frame-size", d.maxFrameSize))
                .bossThreads(AppConfig.getInt("game.server.boss-threads", d.bossThreads))
                .workerThreads(AppConfig.getInt("game.server.worker-threads", d.workerThreads))
                .businessThreads(AppConfig.getInt("game.server.business-threads", d.businessThreads))
                .outboundQueueCapacity(AppConfig.getInt("game.connection.outbound-queue-capacity", d.outboundQueueCapacity))
                .connectionInactiveTimeout(millis("game.connection.inactive-timeout-ms", d.connectionInactiveTimeout))
                .connectionCleanupInterval(millis("game.connection.cleanup-interval-ms", d.connectionCleanupInterval))
                .sessionIdleTimeout(millis("game.session.idle-timeout-ms", d.sessionIdleTimeout))
                .sessionIdleGracePeriod(millis("game.session.idle-grace-ms", d.sessionIdleGracePeriod))
                .sessionSweepInterval(millis("game.session.sweep-interval-ms", d.sessionSweepInterval))
                .heartbeatEnabled(AppConfig.getBoolean("game.heartbeat.enabled", d.heartbeatEnabled))
                .heartbeatInterval(millis("game.heartbeat.interval-ms", d.heartbeatInterval))
                .heartbeatTimeout(millis("game.heartbeat.timeout-ms", d.heartbeatTimeout))
                .heartbeatMaxMissed(AppConfig.getInt("game.heartbeat.max-missed", d.heartbeatMaxMissed))
                .requireAuthentication(AppConfig.getBoolean("game.router.require-authentication", d.requireAuthentication))
                .build();
    }

    private static Duration millis(String key, Duration defaultValue) {
        return Duration.ofMillis(AppConfig.getLong(key, defaultValue.toMillis()));
    }
}
