package server.router;

import lombok.Getter;

/**
 * 消息路由过程中的可恢复错误
 */
@Getter
public class RoutingException extends Exception {
    private final int messageType;
    private final int messageId;

    public RoutingException(String message, int messageType, int messageId) {
        super(message);
        this.messageType = messageType;
        this.messageId = messageId;
    }

    public RoutingException(String message, int messageType, int messageId, Throwable cause) {
        super(message, cause);
        this.messageType = messageType;
        this.messageId = messageId;
    }
}
