package common.message.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 握手响应，告知客户端会话ID与服务端心跳参数
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class HandshakeResponse {
    private boolean success;
    private String sessionId;
    private long heartbeatIntervalMs;
    private long serverTime;
}
