package server.connection;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 连接统计快照
 */
@Getter
@Builder
@ToString
public class ConnectionStats {
    private final long totalConnections;
    private final long activeConnections;
    private final long peakConnections;
    private final long connectionsAccepted;
    private final long connectionsRejected;
    private final long connectionsClosed;
}
