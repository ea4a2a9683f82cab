package server.router;

import common.message.ErrorCode;
import common.message.GameMessage;
import common.message.MessageFlags;
import common.message.MessageHeader;
import common.message.MessageType;
import common.message.ProtocolConstant;
import common.message.payload.ErrorResponse;
import common.serializer.JsonSerializer;

/**
 * 响应消息构建。响应沿用请求的消息ID与玩家ID，便于客户端关联
 */
public final class Responses {

    private Responses() {}

    public static GameMessage response(GameMessage request, int messageType, Object payload) {
        return build(request.getHeader(), messageType, MessageFlags.RESPONSE, payload);
    }

    public static GameMessage response(GameMessage request, Object payload) {
        return response(request, request.getMessageType(), payload);
    }

    /**
     * 构建 ERROR 类型的错误响应，标志位为 RESPONSE|ERROR
     */
    public static GameMessage error(GameMessage request, ErrorCode errorCode, String message) {
        return build(request.getHeader(), MessageType.ERROR, MessageFlags.RESPONSE | MessageFlags.ERROR,
                ErrorResponse.of(errorCode, message));
    }

    /**
     * 服务端主动推送的消息，消息ID由调用方分配
     */
    public static GameMessage push(int messageType, int messageId, long playerId, Object payload) {
        MessageHeader header = MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(messageId)
                .messageType(messageType)
                .playerId(playerId)
                .timestamp(System.currentTimeMillis())
                .build();
        return GameMessage.of(header, JsonSerializer.serialize(payload));
    }

    private static GameMessage build(MessageHeader request, int messageType, int flags, Object payload) {
        MessageHeader header = MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(request.getMessageId())
                .messageType(messageType)
                .flags(flags)
                .playerId(request.getPlayerId())
                .timestamp(request.getTimestamp())
                .build();
        return GameMessage.of(header, JsonSerializer.serialize(payload));
    }
}
