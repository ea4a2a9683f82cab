package server.auth;

/**
 * 凭证校验接口，只在会话认证时调用一次
 */
public interface Authenticator {

    /**
     * 校验客户端提交的凭证
     *
     * @param credential 客户端凭证，例如 JWT
     * @return 凭证对应的玩家ID
     * @throws AuthenticationException 凭证无效或已过期
     */
    String verify(String credential) throws AuthenticationException;
}
