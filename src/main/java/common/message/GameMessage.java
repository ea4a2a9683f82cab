package common.message;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 解码后的协议消息：消息头 + 原始负载。
 * 负载保持字节形式，由具体处理器按需反序列化。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class GameMessage {
    private MessageHeader header;
    private byte[] payload;

    public static GameMessage of(MessageHeader header, byte[] payload) {
        byte[] body = payload != null ? payload : new byte[0];
        header.setLength(body.length);
        return new GameMessage(header, body);
    }

    /**
     * 构建一条请求消息，魔数与时间戳自动填充
     */
    public static GameMessage request(int messageType, int messageId, byte[] payload) {
        MessageHeader header = MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(messageId)
                .messageType(messageType)
                .flags(MessageFlags.REQUEST)
                .timestamp(System.currentTimeMillis())
                .build();
        return of(header, payload);
    }

    public int getMessageId() {
        return header.getMessageId();
    }

    public int getMessageType() {
        return header.getMessageType();
    }
}
