package server.session;

/**
 * 会话状态
 *
 * <pre>
 * NEW -> CONNECTED -> AUTHENTICATED -> ACTIVE <-> IDLE -> DISCONNECTING -> DISCONNECTED
 * </pre>
 */
public enum SessionState {
    NEW,
    CONNECTED,
    AUTHENTICATED,
    ACTIVE,
    IDLE,
    DISCONNECTING,
    DISCONNECTED;

    public boolean isTerminal() {
        return this == DISCONNECTED;
    }

    /**
     * 是否已完成认证（包括认证后的活跃与空闲状态）
     */
    public boolean isAuthenticated() {
        return this == AUTHENTICATED || this == ACTIVE || this == IDLE;
    }
}
