package server.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存令牌表的认证器，用于本地启动和测试。
 * 未预先登记令牌时可开启 acceptAll，此时凭证本身即玩家ID。
 */
public class InMemoryAuthenticator implements Authenticator {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryAuthenticator.class);

    private final Map<String, String> tokens = new ConcurrentHashMap<>();
    private final boolean acceptAll;

    public InMemoryAuthenticator() {
        this(false);
    }

    public InMemoryAuthenticator(boolean acceptAll) {
        this.acceptAll = acceptAll;
    }

    public InMemoryAuthenticator register(String token, String playerId) {
        tokens.put(token, playerId);
        return this;
    }

    public void revoke(String token) {
        tokens.remove(token);
    }

    @Override
    public String verify(String credential) throws AuthenticationException {
        if (credential == null || credential.isEmpty()) {
            throw new AuthenticationException("凭证为空");
        }
        String playerId = tokens.get(credential);
        if (playerId != null) {
            return playerId;
        }
        if (acceptAll) {
            logger.debug("未登记的凭证按玩家ID放行: {}", credential);
            return credential;
        }
        throw new AuthenticationException("无效的凭证");
    }
}
