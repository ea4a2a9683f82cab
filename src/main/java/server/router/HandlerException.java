package server.router;

import lombok.Getter;

/**
 * 业务处理器执行失败。fatal 为 true 时服务端会关闭连接
 */
@Getter
public class HandlerException extends RoutingException {
    private final boolean fatal;

    public HandlerException(String message, int messageType, int messageId, boolean fatal) {
        super(message, messageType, messageId);
        this.fatal = fatal;
    }

    public HandlerException(String message, int messageType, int messageId, boolean fatal, Throwable cause) {
        super(message, messageType, messageId, cause);
        this.fatal = fatal;
    }

    public static HandlerException fatal(String message, int messageType, int messageId) {
        return new HandlerException(message, messageType, messageId, true);
    }
}
