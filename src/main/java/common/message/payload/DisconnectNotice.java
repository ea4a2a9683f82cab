package common.message.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 服务端主动断开前下发的通知，例如账号在别处登录
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class DisconnectNotice {
    private String reason;
    private String message;
}
