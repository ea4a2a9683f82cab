package server.router;

/**
 * 消息头字段非法。调用方已收到 INVALID_MESSAGE 错误响应，连接保持打开
 */
public class InvalidMessageException extends RoutingException {

    public InvalidMessageException(String message, int messageType, int messageId) {
        super(message, messageType, messageId);
    }
}
