package server.router;

import common.message.GameMessage;

/**
 * 业务消息处理器，按消息类型注册到 {@link Router}
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * 处理一条消息。抛出的任何异常都会被路由器记录并包装为 {@link HandlerException}
     */
    void handle(SessionContext context, GameMessage message) throws Exception;
}
