package server.handler;

import common.message.MessageType;
import server.connection.ConnectionRegistry;
import server.heartbeat.HeartbeatMonitor;
import server.router.Router;
import server.session.SessionManager;

/**
 * 注册内置的系统消息处理器
 */
public final class SystemHandlers {

    private SystemHandlers() {}

    public static void register(Router router, SessionManager sessionManager,
                                ConnectionRegistry connectionRegistry, HeartbeatMonitor heartbeatMonitor) {
        router.registerHandler(MessageType.HANDSHAKE, new HandshakeHandler(heartbeatMonitor));
        router.registerHandler(MessageType.AUTH, new AuthHandler(sessionManager, connectionRegistry));
        router.registerHandler(MessageType.HEARTBEAT, new HeartbeatHandler(heartbeatMonitor));
        router.registerHandler(MessageType.PING, new PingHandler());
        router.registerHandler(MessageType.PONG, new PongHandler(heartbeatMonitor));
        router.registerHandler(MessageType.DISCONNECT, new DisconnectHandler(connectionRegistry));
    }
}
