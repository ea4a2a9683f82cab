package server.session;

import common.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Session 状态机测试")
class SessionTest {

    private ManualClock clock;
    private Session session;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        session = new Session("s1", "c1", Duration.ofMinutes(30), clock);
    }

    @Test
    @DisplayName("完整生命周期")
    void shouldFollowLifecycle() {
        session.transitionTo(SessionState.CONNECTED);
        session.transitionTo(SessionState.AUTHENTICATED);
        assertEquals(clock.instant(), session.getAuthTime());

        session.updateActivity();
        assertEquals(SessionState.ACTIVE, session.getState());

        session.transitionTo(SessionState.IDLE);
        assertTrue(session.isIdle());
        session.updateActivity();
        assertTrue(session.isActive());

        session.transitionTo(SessionState.DISCONNECTING);
        session.transitionTo(SessionState.DISCONNECTED);
        assertTrue(session.getState().isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = SessionState.class, names = {"NEW", "CONNECTED", "ACTIVE", "IDLE", "DISCONNECTING"})
    @DisplayName("DISCONNECTED 是终态，不能迁出")
    void shouldRejectTransitionsOutOfDisconnected(SessionState target) {
        session.transitionTo(SessionState.DISCONNECTED);

        IllegalSessionStateException e = assertThrows(IllegalSessionStateException.class,
                () -> session.transitionTo(target));
        assertEquals(SessionState.DISCONNECTED, e.getFrom());
        assertEquals(target, e.getTo());
    }

    @ParameterizedTest
    @EnumSource(value = SessionState.class, names = {"ACTIVE", "IDLE", "DISCONNECTING"})
    @DisplayName("只有 NEW/CONNECTED 可以进入 AUTHENTICATED")
    void shouldRejectAuthenticationFromOtherStates(SessionState from) {
        session.transitionTo(from);
        assertThrows(IllegalSessionStateException.class, () -> session.transitionTo(SessionState.AUTHENTICATED));
        assertEquals(from, session.getState());
    }

    @Test
    @DisplayName("未认证会话的活动不会使其变为 ACTIVE")
    void shouldNotActivateUnauthenticatedSession() {
        clock.advanceSeconds(5);
        session.updateActivity();

        assertEquals(SessionState.NEW, session.getState());
        assertEquals(clock.instant(), session.getLastActivity());
        assertFalse(session.isAuthenticated());
    }

    @Test
    @DisplayName("会话数据读写")
    void shouldStoreSessionData() {
        session.setData("scene", 12);
        Integer scene = session.getData("scene");
        assertEquals(12, scene);
        assertEquals(12, session.removeData("scene"));
        assertNull(session.getData("scene"));
    }
}
