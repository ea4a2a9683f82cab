package server.handler;

import common.message.ErrorCode;
import common.message.GameMessage;
import common.message.MessageType;
import common.message.payload.AuthRequest;
import common.message.payload.AuthResponse;
import common.message.payload.DisconnectNotice;
import common.serializer.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.auth.AuthenticationException;
import server.connection.Connection;
import server.connection.ConnectionException;
import server.connection.ConnectionRegistry;
import server.router.Responses;
import server.router.MessageHandler;
import server.router.SessionContext;
import server.session.AuthenticationResult;
import server.session.IllegalSessionStateException;
import server.session.Session;
import server.session.SessionManager;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 认证处理。失败时回复 AUTH_FAILED，会话保持打开以便重试；
 * 同一玩家的旧会话收到下线通知后被关闭。
 */
public class AuthHandler implements MessageHandler {
    private static final Logger logger = LoggerFactory.getLogger(AuthHandler.class);

    private final SessionManager sessionManager;
    private final ConnectionRegistry connectionRegistry;
    private final AtomicInteger noticeIds = new AtomicInteger();

    public AuthHandler(SessionManager sessionManager, ConnectionRegistry connectionRegistry) {
        this.sessionManager = sessionManager;
        this.connectionRegistry = connectionRegistry;
    }

    @Override
    public void handle(SessionContext context, GameMessage message) throws Exception {
        AuthRequest request = JsonSerializer.deserialize(message.getPayload(), AuthRequest.class);
        if (request == null || request.getToken() == null || request.getToken().isEmpty()) {
            context.replyError(message, ErrorCode.AUTH_FAILED, "Missing token");
            return;
        }

        AuthenticationResult result;
        try {
            result = sessionManager.authenticate(context.getSessionId(), request.getToken());
        } catch (AuthenticationException e) {
            context.replyError(message, ErrorCode.AUTH_FAILED, e.getMessage());
            return;
        } catch (IllegalSessionStateException e) {
            context.replyError(message, ErrorCode.INVALID_STATE, e.getMessage());
            return;
        }

        context.reply(message, AuthResponse.builder()
                .success(true)
                .message("ok")
                .playerId(result.getPlayerId())
                .sessionId(context.getSessionId())
                .serverTime(System.currentTimeMillis())
                .build());
        result.getDisplaced().ifPresent(this::kick);
    }

    private void kick(Session displaced) {
        Optional<Connection> connection = connectionRegistry.get(displaced.getConnectionId());
        if (!connection.isPresent()) {
            return;
        }
        GameMessage notice = Responses.push(MessageType.DISCONNECT, noticeIds.incrementAndGet(), 0L,
                new DisconnectNotice(ErrorCode.SESSION_REPLACED.name(), "Logged in from another connection"));
        try {
            connection.get().send(notice);
        } catch (ConnectionException e) {
            logger.debug("旧会话 {} 的连接已不可用: {}", displaced.getId(), e.getMessage());
        }
        connectionRegistry.remove(displaced.getConnectionId());
        logger.info("旧会话 {} 已被顶替并关闭连接 {}", displaced.getId(), displaced.getConnectionId());
    }
}
