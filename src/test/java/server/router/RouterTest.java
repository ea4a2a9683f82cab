package server.router;

import common.message.ErrorCode;
import common.message.GameMessage;
import common.message.MessageFlags;
import common.message.MessageHeader;
import common.message.MessageType;
import common.message.ProtocolConstant;
import common.message.payload.ErrorResponse;
import common.metrics.InMemoryMetricsSink;
import common.serializer.JsonSerializer;
import common.support.ManualClock;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import server.config.ServerConfig;
import server.connection.Connection;
import server.connection.ConnectionClosedException;
import server.session.Session;
import server.session.SessionState;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("Router 测试")
class RouterTest {

    private static final int UNKNOWN_TYPE = 0x0999;

    private ManualClock clock;
    private InMemoryMetricsSink metrics;
    private Router router;
    private EmbeddedChannel channel;
    private Connection connection;
    private Session session;
    private SessionContext context;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        metrics = new InMemoryMetricsSink();
        router = new Router(ServerConfig.defaults(), metrics);
        channel = new EmbeddedChannel();
        connection = new Connection("c1", channel, 100, clock);
        session = new Session("s1", "c1", Duration.ofMinutes(30), clock);
        context = new SessionContext(session, connection);
    }

    private static GameMessage message(int type, int id) {
        MessageHeader header = MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(id)
                .messageType(type)
                .flags(MessageFlags.REQUEST)
                .playerId(77L)
                .timestamp(1_700_000_000_000L)
                .build();
        return GameMessage.of(header, new byte[0]);
    }

    private void authenticate() {
        session.transitionTo(SessionState.AUTHENTICATED);
    }

    private GameMessage readResponse() {
        GameMessage response = channel.readOutbound();
        assertNotNull(response, "应收到一条响应");
        return response;
    }

    private static ErrorResponse errorOf(GameMessage response) {
        return JsonSerializer.deserialize(response.getPayload(), ErrorResponse.class);
    }

    @Nested
    @DisplayName("未注册的消息类型")
    class Unhandled {

        @Test
        @DisplayName("回复同一消息ID的 ERROR 响应并正常返回")
        void shouldReplyCorrelatedError() throws Exception {
            router.routeMessage(context, message(UNKNOWN_TYPE, 42));

            GameMessage response = readResponse();
            assertEquals(42, response.getMessageId());
            assertEquals(MessageType.ERROR, response.getMessageType());
            assertTrue(response.getHeader().hasFlag(MessageFlags.ERROR));
            assertTrue(response.getHeader().hasFlag(MessageFlags.RESPONSE));
            assertEquals(77L, response.getHeader().getPlayerId());
            assertEquals(1_700_000_000_000L, response.getHeader().getTimestamp());

            ErrorResponse error = errorOf(response);
            assertFalse(error.isSuccess());
            assertEquals("UNHANDLED_MESSAGE", error.getErrorType());
            assertEquals(ErrorCode.UNHANDLED_MESSAGE.getCode(), error.getErrorCode());
            assertEquals(1, metrics.getCounter("router.unhandled"));
        }

        @Test
        @DisplayName("连接已关闭时以 ConnectionClosedException 返回")
        void shouldSurfaceClosedConnection() {
            connection.close();
            assertThrows(ConnectionClosedException.class,
                    () -> router.routeMessage(context, message(UNKNOWN_TYPE, 1)));
        }
    }

    @Nested
    @DisplayName("消息校验")
    class Validation {

        @Test
        @DisplayName("合法消息通过校验")
        void shouldAcceptValidMessage() {
            assertDoesNotThrow(() -> router.validateMessage(message(MessageType.HEARTBEAT, 1)));
        }

        @Test
        @DisplayName("空消息被拒绝")
        void shouldRejectNull() {
            assertThrows(InvalidMessageException.class, () -> router.validateMessage(null));
        }

        @Test
        @DisplayName("魔数、类型、ID、时间戳任一非法都被拒绝")
        void shouldRejectInvalidFields() {
            GameMessage badMagic = message(MessageType.HEARTBEAT, 1);
            badMagic.getHeader().setMagic(0x1234);
            GameMessage badType = message(0, 1);
            GameMessage badId = message(MessageType.HEARTBEAT, 0);
            GameMessage badTimestamp = message(MessageType.HEARTBEAT, 1);
            badTimestamp.getHeader().setTimestamp(0);

            for (GameMessage msg : List.of(badMagic, badType, badId, badTimestamp)) {
                assertThrows(InvalidMessageException.class, () -> router.validateMessage(msg));
            }
        }

        @Test
        @DisplayName("路由非法消息时先回复 INVALID_MESSAGE 再抛出异常，处理器不被调用")
        void shouldReplyBeforeThrowing() throws Exception {
            MessageHandler handler = mock(MessageHandler.class);
            router.registerHandler(MessageType.HEARTBEAT, handler);
            GameMessage msg = message(MessageType.HEARTBEAT, 9);
            msg.getHeader().setTimestamp(-1);

            assertThrows(InvalidMessageException.class, () -> router.routeMessage(context, msg));

            GameMessage response = readResponse();
            assertEquals(9, response.getMessageId());
            assertEquals("INVALID_MESSAGE", errorOf(response).getErrorType());
            verify(handler, never()).handle(any(), any());
        }
    }

    @Nested
    @DisplayName("处理器分发")
    class Dispatch {

        @Test
        @DisplayName("按类型调用注册的处理器")
        void shouldInvokeHandler() throws Exception {
            authenticate();
            MessageHandler handler = mock(MessageHandler.class);
            router.registerHandler(MessageType.PLAYER_MOVE, handler);
            GameMessage msg = message(MessageType.PLAYER_MOVE, 3);

            router.routeMessage(context, msg);

            verify(handler).handle(context, msg);
            assertEquals(1, metrics.getCounter("router.handled"));
            assertEquals(1, metrics.getObservationCount("router.handle_duration"));
        }

        @Test
        @DisplayName("重复注册以最后一次为准")
        void shouldLetLastRegistrationWin() throws Exception {
            authenticate();
            MessageHandler first = mock(MessageHandler.class);
            MessageHandler second = mock(MessageHandler.class);
            router.registerHandler(MessageType.ITEM_USE, first);
            router.registerHandler(MessageType.ITEM_USE, second);

            router.routeMessage(context, message(MessageType.ITEM_USE, 5));

            verify(first, never()).handle(any(), any());
            verify(second).handle(any(), any());
            assertEquals(1, router.getHandlerCount());
        }

        @Test
        @DisplayName("处理器异常被包装为非致命 HandlerException")
        void shouldWrapHandlerFailure() throws Exception {
            authenticate();
            MessageHandler handler = mock(MessageHandler.class);
            IllegalStateException cause = new IllegalStateException("db down");
            doThrow(cause).when(handler).handle(any(), any());
            router.registerHandler(MessageType.QUEST_ACCEPT, handler);

            HandlerException e = assertThrows(HandlerException.class,
                    () -> router.routeMessage(context, message(MessageType.QUEST_ACCEPT, 11)));

            assertFalse(e.isFatal());
            assertSame(cause, e.getCause());
            assertEquals(11, e.getMessageId());
            assertEquals(MessageType.QUEST_ACCEPT, e.getMessageType());
            assertEquals(1, metrics.getCounter("router.handler_errors"));
        }

        @Test
        @DisplayName("处理器主动抛出的致命异常原样传出")
        void shouldPropagateFatalHandlerException() {
            authenticate();
            router.registerHandler(MessageType.BATTLE_ACTION, (ctx, msg) -> {
                throw HandlerException.fatal("cheat detected", msg.getMessageType(), msg.getMessageId());
            });

            HandlerException e = assertThrows(HandlerException.class,
                    () -> router.routeMessage(context, message(MessageType.BATTLE_ACTION, 2)));
            assertTrue(e.isFatal());
        }

        @Test
        @DisplayName("处理器可通过上下文回复")
        void shouldReplyThroughContext() throws Exception {
            router.registerHandler(MessageType.HANDSHAKE, (ctx, msg) -> ctx.reply(msg, null));

            router.routeMessage(context, message(MessageType.HANDSHAKE, 8));

            GameMessage response = readResponse();
            assertEquals(8, response.getMessageId());
            assertEquals(MessageType.HANDSHAKE, response.getMessageType());
            assertTrue(response.getHeader().hasFlag(MessageFlags.RESPONSE));
            assertFalse(response.getHeader().hasFlag(MessageFlags.ERROR));
            assertEquals(1, response.getHeader().getSequence());
        }
    }

    @Nested
    @DisplayName("认证检查")
    class AuthCheck {

        @Test
        @DisplayName("未认证会话发送业务消息时回复 NOT_AUTHENTICATED")
        void shouldRejectUnauthenticatedBusinessMessage() throws Exception {
            MessageHandler handler = mock(MessageHandler.class);
            router.registerHandler(MessageType.CHAT_MESSAGE, handler);

            router.routeMessage(context, message(MessageType.CHAT_MESSAGE, 4));

            verify(handler, never()).handle(any(), any());
            assertEquals("NOT_AUTHENTICATED", errorOf(readResponse()).getErrorType());
        }

        @Test
        @DisplayName("系统消息无需认证")
        void shouldAllowSystemMessages() throws Exception {
            MessageHandler handler = mock(MessageHandler.class);
            router.registerHandler(MessageType.AUTH, handler);

            router.routeMessage(context, message(MessageType.AUTH, 4));

            verify(handler).handle(any(), any());
        }

        @Test
        @DisplayName("关闭认证要求后业务消息直接分发")
        void shouldSkipCheckWhenDisabled() throws Exception {
            Router open = new Router(ServerConfig.builder().requireAuthentication(false).build(), metrics);
            MessageHandler handler = mock(MessageHandler.class);
            open.registerHandler(MessageType.CHAT_MESSAGE, handler);

            open.routeMessage(context, message(MessageType.CHAT_MESSAGE, 4));

            verify(handler).handle(any(), any());
        }
    }

    @Nested
    @DisplayName("处理器注册表")
    class Registry {

        @Test
        @DisplayName("注册、查询与注销")
        void shouldManageHandlers() {
            MessageHandler handler = (ctx, msg) -> { };
            router.registerHandler(MessageType.PET_SUMMON, handler);
            router.registerHandler(MessageType.HEARTBEAT, handler);

            assertEquals(List.of(MessageType.HEARTBEAT, MessageType.PET_SUMMON), router.getRegisteredMessageTypes());
            assertTrue(router.isMessageTypeSupported(MessageType.PET_SUMMON));
            assertSame(handler, router.getHandler(MessageType.PET_SUMMON));

            router.unregisterHandler(MessageType.PET_SUMMON);
            assertFalse(router.isMessageTypeSupported(MessageType.PET_SUMMON));
            assertNull(router.getHandler(MessageType.PET_SUMMON));
            assertEquals(1, router.getHandlerCount());
            assertDoesNotThrow(router::logStats);
        }
    }
}
