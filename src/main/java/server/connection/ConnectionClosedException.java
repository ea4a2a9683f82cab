package server.connection;

/**
 * 连接已关闭或已被移除。属于可恢复错误，调用方记录日志即可。
 */
public class ConnectionClosedException extends ConnectionException {

    public ConnectionClosedException(String connectionId) {
        super(connectionId, "connection gone: " + connectionId);
    }
}
