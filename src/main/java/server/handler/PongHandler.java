package server.handler;

import common.message.GameMessage;
import server.heartbeat.HeartbeatMonitor;
import server.router.MessageHandler;
import server.router.SessionContext;

public class PongHandler implements MessageHandler {
    private final HeartbeatMonitor heartbeatMonitor;

    public PongHandler(HeartbeatMonitor heartbeatMonitor) {
        this.heartbeatMonitor = heartbeatMonitor;
    }

    @Override
    public void handle(SessionContext context, GameMessage message) {
        heartbeatMonitor.onProbeReply(context.getConnection().getId());
    }
}
