package common.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消息头，字段顺序与线上格式一致
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class MessageHeader {
    // 魔数，必须等于 ProtocolConstant.MAGIC
    private int magic;

    // 消息ID，用于请求/响应关联
    private int messageId;

    // 消息类型，按子系统分段
    private int messageType;

    // 标志位，只使用低16位
    private int flags;

    // 玩家ID，未认证或系统消息为0
    private long playerId;

    // 发送方时间戳（毫秒）
    private long timestamp;

    // 连接内单调递增序号，可选
    private int sequence;

    // 负载字节数，编码时以实际负载为准
    private int length;

    public boolean hasFlag(int flag) {
        return MessageFlags.has(flags, flag);
    }
}
