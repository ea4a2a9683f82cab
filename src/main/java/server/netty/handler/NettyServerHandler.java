package server.netty.handler;

import common.codec.FrameDecodeException;
import common.message.ErrorCode;
import common.message.GameMessage;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.GameGateway;
import server.connection.Connection;
import server.connection.ConnectionException;
import server.router.HandlerException;
import server.router.InvalidMessageException;
import server.router.RoutingException;
import server.router.SessionContext;
import server.session.Session;

import java.util.Optional;
import java.util.UUID;

/**
 * 每条连接一个实例：建立连接时登记连接、会话与心跳，收到消息后交给路由器，
 * 连接断开时从注册表移除并级联清理。
 */
public class NettyServerHandler extends SimpleChannelInboundHandler<GameMessage> {
    private static final Logger logger = LoggerFactory.getLogger(NettyServerHandler.class);

    private final GameGateway gateway;
    private final String connectionId;
    private Connection connection;

    public NettyServerHandler(GameGateway gateway) {
        this(gateway, null);
    }

    /**
     * @param connectionId 指定连接ID，为空时使用 Channel 短ID
     */
    public NettyServerHandler(GameGateway gateway, String connectionId) {
        this.gateway = gateway;
        this.connectionId = connectionId;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int capacity = gateway.getConfig().getOutboundQueueCapacity();
        Connection conn = connectionId != null
                ? new Connection(connectionId, ctx.channel(), capacity, gateway.getClock())
                : Connection.of(ctx.channel(), capacity, gateway.getClock());
        if (!gateway.getConnectionRegistry().add(conn)) {
            ctx.close();
            return;
        }
        connection = conn;
        try {
            gateway.getSessionManager().createSession(UUID.randomUUID().toString(), conn.getId());
        } catch (IllegalStateException e) {
            logger.error("连接 {} 创建会话失败，关闭连接: {}", conn.getId(), e.getMessage());
            gateway.getConnectionRegistry().remove(conn.getId());
            return;
        }
        gateway.getHeartbeatMonitor().track(conn);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, GameMessage msg) {
        if (connection == null) {
            return;
        }
        connection.touch();
        Optional<Session> session = gateway.getSessionManager().getSessionByConnection(connection.getId());
        if (!session.isPresent()) {
            logger.warn("连接 {} 没有对应的会话，关闭连接", connection.getId());
            gateway.getConnectionRegistry().remove(connection.getId());
            return;
        }
        session.get().updateActivity();

        SessionContext context = new SessionContext(session.get(), connection);
        try {
            gateway.getRouter().routeMessage(context, msg);
        } catch (InvalidMessageException e) {
            logger.debug("非法消息已回复错误, 连接 {}: {}", connection.getId(), e.getMessage());
        } catch (HandlerException e) {
            if (e.isFatal()) {
                logger.warn("处理器返回致命错误，关闭连接 {}: {}", connection.getId(), e.getMessage());
                gateway.getConnectionRegistry().remove(connection.getId());
            } else {
                replyHandlerError(context, msg, e);
            }
        } catch (RoutingException e) {
            logger.warn("路由消息失败, 连接 {}: {}", connection.getId(), e.getMessage());
        } catch (ConnectionException e) {
            logger.debug("连接 {} 已不可写: {}", connection.getId(), e.getMessage());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connection != null) {
            gateway.getConnectionRegistry().remove(connection.getId());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        String id = connection != null ? connection.getId() : ctx.channel().id().asShortText();
        if (cause instanceof FrameDecodeException) {
            logger.warn("连接 {} 帧格式错误，直接关闭: {}", id, cause.getMessage());
        } else {
            logger.error("连接 {} 处理时出错: {}", id, cause.getMessage(), cause);
        }
        if (connection != null) {
            gateway.getConnectionRegistry().remove(connection.getId());
        } else {
            ctx.close();
        }
    }

    private void replyHandlerError(SessionContext context, GameMessage msg, HandlerException e) {
        try {
            context.replyError(msg, ErrorCode.HANDLER_ERROR, e.getMessage());
        } catch (ConnectionException ce) {
            logger.debug("回复处理错误失败, 连接 {}: {}", connection.getId(), ce.getMessage());
        }
    }
}
