package server.session;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends RuntimeException {
    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("会话不存在: " + sessionId);
        this.sessionId = sessionId;
    }
}
