package server.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("内存认证器测试")
class InMemoryAuthenticatorTest {

    @Test
    @DisplayName("登记的令牌映射到玩家ID，撤销后失效")
    void shouldVerifyRegisteredToken() throws AuthenticationException {
        InMemoryAuthenticator authenticator = new InMemoryAuthenticator().register("t1", "p1");

        assertEquals("p1", authenticator.verify("t1"));
        authenticator.revoke("t1");
        assertThrows(AuthenticationException.class, () -> authenticator.verify("t1"));
    }

    @Test
    @DisplayName("空凭证总是失败")
    void shouldRejectEmptyCredential() {
        InMemoryAuthenticator authenticator = new InMemoryAuthenticator(true);

        assertThrows(AuthenticationException.class, () -> authenticator.verify(""));
        assertThrows(AuthenticationException.class, () -> authenticator.verify(null));
    }

    @Test
    @DisplayName("acceptAll 模式下未登记的凭证即玩家ID")
    void shouldAcceptUnknownWhenOpen() throws AuthenticationException {
        assertEquals("guest", new InMemoryAuthenticator(true).verify("guest"));
    }
}
