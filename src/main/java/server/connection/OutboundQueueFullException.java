package server.connection;

/**
 * 发送队列已满，客户端消费速度跟不上。抛出前连接已被关闭。
 */
public class OutboundQueueFullException extends ConnectionException {

    public OutboundQueueFullException(String connectionId, int capacity) {
        super(connectionId, "outbound queue full (capacity " + capacity + "): " + connectionId);
    }
}
