package server;

import common.metrics.InMemoryMetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.auth.InMemoryAuthenticator;
import server.config.ServerConfig;
import server.server.impl.NettyGameServer;

import java.time.Clock;

/**
 * 本地启动入口。配置通过 application.properties 或 -Dgame.server.port=... 覆盖
 */
public class GameServerBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(GameServerBootstrap.class);

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.load();
        // 开发环境放行所有凭证，凭证即玩家ID
        GameGateway gateway = new GameGateway(config, new InMemoryAuthenticator(true),
                Clock.systemUTC(), new InMemoryMetricsSink());
        NettyGameServer server = new NettyGameServer(gateway);
        server.start(config.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "gateway-shutdown"));
        logger.info("按 Ctrl+C 停止服务");
        Thread.currentThread().join();
    }
}
