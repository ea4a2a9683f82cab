package common.message.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class HeartbeatResponse {
    private boolean success;
    private String message;
    private long serverTime;

    public static HeartbeatResponse pong() {
        return new HeartbeatResponse(true, "pong", System.currentTimeMillis());
    }
}
