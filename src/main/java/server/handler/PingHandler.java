package server.handler;

import common.message.GameMessage;
import common.message.MessageType;
import server.router.MessageHandler;
import server.router.SessionContext;

// 客户端探测服务端，原样回 PONG
public class PingHandler implements MessageHandler {

    @Override
    public void handle(SessionContext context, GameMessage message) throws Exception {
        context.reply(message, MessageType.PONG, null);
    }
}
