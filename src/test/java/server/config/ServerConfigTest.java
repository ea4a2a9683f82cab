package server.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("服务配置测试")
class ServerConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("game.heartbeat.interval-ms");
        System.clearProperty("game.server.max-connections");
    }

    @Test
    @DisplayName("默认值")
    void shouldProvideDefaults() {
        ServerConfig config = ServerConfig.defaults();

        assertEquals(Duration.ofSeconds(30), config.getHeartbeatInterval());
        assertEquals(Duration.ofSeconds(10), config.getHeartbeatTimeout());
        assertEquals(3, config.getHeartbeatMaxMissed());
        assertEquals(Duration.ofMinutes(30), config.getSessionIdleTimeout());
        assertEquals(1024 * 1024, config.getMaxFrameSize());
        assertTrue(config.isRequireAuthentication());
    }

    @Test
    @DisplayName("系统属性覆盖配置文件")
    void shouldPreferSystemProperties() {
        System.setProperty("game.heartbeat.interval-ms", "5000");
        System.setProperty("game.server.max-connections", "12");

        ServerConfig config = ServerConfig.load();

        assertEquals(Duration.ofSeconds(5), config.getHeartbeatInterval());
        assertEquals(12, config.getMaxConnections());
    }

    @Test
    @DisplayName("非法数值回退为默认值")
    void shouldFallBackOnInvalidNumber() {
        System.setProperty("game.server.max-connections", "many");

        assertEquals(ServerConfig.defaults().getMaxConnections(), ServerConfig.load().getMaxConnections());
    }
}
