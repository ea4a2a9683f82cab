package server.heartbeat;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 单条连接的心跳状态，由 {@link HeartbeatMonitor} 在锁内修改，对外只暴露快照
 */
@Getter
@ToString
public class HeartbeatStatus {
    private final String connectionId;
    private Instant lastSent;
    private Instant lastReceived;
    private int missedCount;
    private Duration rtt = Duration.ZERO;
    private boolean alive = true;

    HeartbeatStatus(String connectionId, Instant now) {
        this.connectionId = connectionId;
        this.lastReceived = now;
    }

    private HeartbeatStatus(HeartbeatStatus other) {
        this.connectionId = other.connectionId;
        this.lastSent = other.lastSent;
        this.lastReceived = other.lastReceived;
        this.missedCount = other.missedCount;
        this.rtt = other.rtt;
        this.alive = other.alive;
    }

    void markSent(Instant now) {
        lastSent = now;
    }

    void markMissed() {
        missedCount++;
        alive = false;
    }

    void markReceived(Instant now, boolean measureRtt) {
        lastReceived = now;
        missedCount = 0;
        alive = true;
        if (measureRtt && lastSent != null) {
            rtt = Duration.between(lastSent, now);
        }
    }

    HeartbeatStatus snapshot() {
        return new HeartbeatStatus(this);
    }
}
