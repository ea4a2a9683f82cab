package client.netty.handler;

import client.netty.PendingRequests;
import common.message.GameMessage;
import common.message.MessageFlags;
import common.message.MessageHeader;
import common.message.MessageType;
import common.message.ProtocolConstant;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.ClosedChannelException;
import java.util.function.Consumer;

/**
 * 客户端入站处理：响应交给 {@link PendingRequests}，服务端 PING 自动回 PONG，
 * 其余消息（推送、下线通知）交给推送回调
 */
public class NettyClientHandler extends SimpleChannelInboundHandler<GameMessage> {
    private static final Logger logger = LoggerFactory.getLogger(NettyClientHandler.class);

    private final PendingRequests pendingRequests;
    private final boolean autoPong;
    private final Consumer<GameMessage> pushListener;

    public NettyClientHandler(PendingRequests pendingRequests, boolean autoPong, Consumer<GameMessage> pushListener) {
        this.pendingRequests = pendingRequests;
        this.autoPong = autoPong;
        this.pushListener = pushListener;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, GameMessage msg) {
        if (msg.getMessageType() == MessageType.PING && !msg.getHeader().hasFlag(MessageFlags.RESPONSE)) {
            if (autoPong) {
                ctx.writeAndFlush(pong(msg));
            }
            return;
        }
        if (msg.getHeader().hasFlag(MessageFlags.RESPONSE) && pendingRequests.complete(msg)) {
            return;
        }
        try {
            pushListener.accept(msg);
        } catch (Exception e) {
            logger.error("推送回调处理失败, type={}, id={}", msg.getMessageType(), msg.getMessageId(), e);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        pendingRequests.failAll(new ClosedChannelException());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("客户端处理消息时出错: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static GameMessage pong(GameMessage ping) {
        MessageHeader header = MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(ping.getMessageId())
                .messageType(MessageType.PONG)
                .flags(MessageFlags.RESPONSE)
                .playerId(ping.getHeader().getPlayerId())
                .timestamp(System.currentTimeMillis())
                .build();
        return GameMessage.of(header, new byte[0]);
    }
}
