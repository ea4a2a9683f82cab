package common.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 协议错误码，随 ERROR 消息下发给客户端
 */
@Getter
@AllArgsConstructor
public enum ErrorCode {
    INVALID_MESSAGE(1001),
    UNHANDLED_MESSAGE(1002),
    NOT_AUTHENTICATED(1003),
    AUTH_FAILED(1004),
    HANDLER_ERROR(1005),
    INVALID_STATE(1006),
    SESSION_REPLACED(1007);

    private final int code;
}
