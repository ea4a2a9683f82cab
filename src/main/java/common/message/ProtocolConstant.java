package common.message;

/**
 * 协议常量
 *
 * <pre>
 * 帧格式（大端序，头部固定 38 字节）:
 * +-------+-----------+-------------+-------+----------+-----------+----------+--------+---------+
 * | Magic | MessageID | MessageType | Flags | PlayerID | Timestamp | Sequence | Length | Payload |
 * |  4B   |    4B     |     4B      |  2B   |    8B    |    8B     |    4B    |   4B   |   N B   |
 * +-------+-----------+-------------+-------+----------+-----------+----------+--------+---------+
 * </pre>
 */
public interface ProtocolConstant {

    /**
     * 协议魔数 "GWKS"
     */
    int MAGIC = 0x47574B53;

    /**
     * 消息头长度
     */
    int HEADER_LENGTH = 38;

    /**
     * Length 字段在头部中的偏移
     */
    int LENGTH_FIELD_OFFSET = 34;

    /**
     * 默认最大负载长度 1MB
     */
    int DEFAULT_MAX_FRAME_SIZE = 1024 * 1024;
}
