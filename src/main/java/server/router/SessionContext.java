package server.router;

import common.message.ErrorCode;
import common.message.GameMessage;
import lombok.Getter;
import server.connection.Connection;
import server.connection.ConnectionException;
import server.session.Session;

/**
 * 单条消息的处理上下文，持有当前会话与连接
 */
@Getter
public class SessionContext {
    private final Session session;
    private final Connection connection;

    public SessionContext(Session session, Connection connection) {
        this.session = session;
        this.connection = connection;
    }

    public String getSessionId() {
        return session.getId();
    }

    public String getPlayerId() {
        return session.getPlayerId();
    }

    public boolean isAuthenticated() {
        return session.isAuthenticated();
    }

    /**
     * 以请求的消息类型回复
     */
    public void reply(GameMessage request, Object payload) throws ConnectionException {
        send(Responses.response(request, payload));
    }

    public void reply(GameMessage request, int responseType, Object payload) throws ConnectionException {
        send(Responses.response(request, responseType, payload));
    }

    public void replyError(GameMessage request, ErrorCode errorCode, String message) throws ConnectionException {
        send(Responses.error(request, errorCode, message));
    }

    public void send(GameMessage message) throws ConnectionException {
        message.getHeader().setSequence(connection.nextSequence());
        connection.send(message);
    }
}
