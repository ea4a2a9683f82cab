package server.session;

import lombok.Getter;

/**
 * 非法的会话状态迁移
 */
@Getter
public class IllegalSessionStateException extends IllegalStateException {
    private final String sessionId;
    private final SessionState from;
    private final SessionState to;

    public IllegalSessionStateException(String sessionId, SessionState from, SessionState to) {
        super("会话 " + sessionId + " 不允许从 " + from + " 迁移到 " + to);
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }
}
