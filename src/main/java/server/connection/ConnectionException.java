package server.connection;

import lombok.Getter;

/**
 * 连接级发送失败的基类
 */
@Getter
public class ConnectionException extends Exception {
    private final String connectionId;

    public ConnectionException(String connectionId, String message) {
        super(message);
        this.connectionId = connectionId;
    }
}
