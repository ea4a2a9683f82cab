package server.handler;

import common.message.ErrorCode;
import common.message.GameMessage;
import common.message.payload.HandshakeResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.heartbeat.HeartbeatMonitor;
import server.router.MessageHandler;
import server.router.SessionContext;
import server.session.Session;
import server.session.SessionState;

/**
 * 握手：NEW -> CONNECTED
 */
public class HandshakeHandler implements MessageHandler {
    private static final Logger logger = LoggerFactory.getLogger(HandshakeHandler.class);

    private final HeartbeatMonitor heartbeatMonitor;

    public HandshakeHandler(HeartbeatMonitor heartbeatMonitor) {
        this.heartbeatMonitor = heartbeatMonitor;
    }

    @Override
    public void handle(SessionContext context, GameMessage message) throws Exception {
        Session session = context.getSession();
        SessionState state = session.getState();
        if (state != SessionState.NEW && state != SessionState.CONNECTED) {
            context.replyError(message, ErrorCode.INVALID_STATE, "Handshake not allowed in state " + state);
            return;
        }
        session.transitionTo(SessionState.CONNECTED);
        logger.debug("会话 {} 握手完成", session.getId());
        context.reply(message, HandshakeResponse.builder()
                .success(true)
                .sessionId(session.getId())
                .heartbeatIntervalMs(heartbeatMonitor.getInterval().toMillis())
                .serverTime(System.currentTimeMillis())
                .build());
    }
}
