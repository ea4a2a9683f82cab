package common.message.payload;

import common.message.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 错误响应体
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ErrorResponse {
    private boolean success;
    private String message;
    private int errorCode;
    // 错误类型名，例如 UNHANDLED_MESSAGE
    private String errorType;
    private long timestamp;

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return ErrorResponse.builder()
                .success(false)
                .message(message)
                .errorCode(errorCode.getCode())
                .errorType(errorCode.name())
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
