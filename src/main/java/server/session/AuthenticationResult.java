package server.session;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * 认证结果：认证通过的玩家，以及被顶下线的旧会话（如果有）
 */
@Getter
@AllArgsConstructor
public class AuthenticationResult {
    private final Session session;
    private final String playerId;
    private final Session displacedSession;

    public Optional<Session> getDisplaced() {
        return Optional.ofNullable(displacedSession);
    }
}
