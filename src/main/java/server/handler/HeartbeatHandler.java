package server.handler;

import common.message.GameMessage;
import common.message.payload.HeartbeatResponse;
import server.heartbeat.HeartbeatMonitor;
import server.router.MessageHandler;
import server.router.SessionContext;

/**
 * 客户端主动心跳，回复同类型响应
 */
public class HeartbeatHandler implements MessageHandler {
    private final HeartbeatMonitor heartbeatMonitor;

    public HeartbeatHandler(HeartbeatMonitor heartbeatMonitor) {
        this.heartbeatMonitor = heartbeatMonitor;
    }

    @Override
    public void handle(SessionContext context, GameMessage message) throws Exception {
        heartbeatMonitor.onHeartbeat(context.getConnection().getId());
        context.reply(message, HeartbeatResponse.pong());
    }
}
