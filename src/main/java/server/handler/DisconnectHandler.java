package server.handler;

import common.message.GameMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.connection.ConnectionRegistry;
import server.router.MessageHandler;
import server.router.SessionContext;
import server.session.Session;
import server.session.SessionState;

/**
 * 客户端主动断开
 */
public class DisconnectHandler implements MessageHandler {
    private static final Logger logger = LoggerFactory.getLogger(DisconnectHandler.class);

    private final ConnectionRegistry connectionRegistry;

    public DisconnectHandler(ConnectionRegistry connectionRegistry) {
        this.connectionRegistry = connectionRegistry;
    }

    @Override
    public void handle(SessionContext context, GameMessage message) {
        Session session = context.getSession();
        if (!session.getState().isTerminal()) {
            session.transitionTo(SessionState.DISCONNECTING);
        }
        logger.info("会话 {} 主动断开, 玩家: {}", session.getId(), session.getPlayerId());
        connectionRegistry.remove(context.getConnection().getId());
    }
}
