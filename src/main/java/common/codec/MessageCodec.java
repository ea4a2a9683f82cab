package common.codec;

import common.message.GameMessage;
import common.message.MessageHeader;
import common.message.ProtocolConstant;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Getter;

/**
 * 消息编解码器，负责消息头与负载的二进制读写。
 *
 * <p>字段按 {@link ProtocolConstant} 中描述的顺序以大端序写入，
 * Length 字段总是等于实际负载长度，对端只读头部即可分配精确大小的缓冲区。
 * 解码时只要有 4 个字节就先校验魔数，再校验头部是否完整与长度，最后才读取其余字段。</p>
 */
public class MessageCodec {

    @Getter
    private final int maxFrameSize;

    public MessageCodec() {
        this(ProtocolConstant.DEFAULT_MAX_FRAME_SIZE);
    }

    public MessageCodec(int maxFrameSize) {
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("maxFrameSize must be positive: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
    }

    public byte[] encode(MessageHeader header, byte[] payload) {
        byte[] body = payload != null ? payload : new byte[0];
        ByteBuf buf = Unpooled.buffer(ProtocolConstant.HEADER_LENGTH + body.length);
        try {
            writeFrame(header, body, buf);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    public void encode(GameMessage message, ByteBuf out) {
        writeFrame(message.getHeader(), message.getPayload() != null ? message.getPayload() : new byte[0], out);
    }

    /**
     * 解码一个完整帧，字节数组中多余的数据会被忽略
     */
    public GameMessage decode(byte[] bytes) {
        if (bytes == null) {
            throw new FrameDecodeException(FrameDecodeException.Reason.SHORT_BUFFER, "empty input");
        }
        return decode(Unpooled.wrappedBuffer(bytes));
    }

    /**
     * 从 ByteBuf 当前读位置解码一个完整帧，成功后读指针移动到帧末尾
     */
    public GameMessage decode(ByteBuf in) {
        int readable = in.readableBytes();
        if (readable >= Integer.BYTES) {
            checkMagic(in);
        }
        if (readable < ProtocolConstant.HEADER_LENGTH) {
            throw new FrameDecodeException(FrameDecodeException.Reason.SHORT_BUFFER,
                    "need " + ProtocolConstant.HEADER_LENGTH + " bytes for header, got " + readable);
        }
        long length = checkLength(in);
        if (readable < ProtocolConstant.HEADER_LENGTH + length) {
            throw new FrameDecodeException(FrameDecodeException.Reason.SHORT_BUFFER,
                    "declared payload " + length + " bytes, only " + (readable - ProtocolConstant.HEADER_LENGTH) + " available");
        }

        MessageHeader header = MessageHeader.builder()
                .magic(in.readInt())
                .messageId(in.readInt())
                .messageType(in.readInt())
                .flags(in.readUnsignedShort())
                .playerId(in.readLong())
                .timestamp(in.readLong())
                .sequence(in.readInt())
                .length((int) in.readUnsignedInt())
                .build();
        byte[] payload = new byte[header.getLength()];
        in.readBytes(payload);
        return new GameMessage(header, payload);
    }

    /**
     * 不移动读指针地校验魔数，至少需要 4 个可读字节
     */
    void checkMagic(ByteBuf in) {
        int magic = in.getInt(in.readerIndex());
        if (magic != ProtocolConstant.MAGIC) {
            throw new FrameDecodeException(FrameDecodeException.Reason.BAD_MAGIC,
                    String.format("expected 0x%08X, got 0x%08X", ProtocolConstant.MAGIC, magic));
        }
    }

    /**
     * 不移动读指针地读取并校验声明的负载长度，需要完整的头部
     */
    long checkLength(ByteBuf in) {
        long length = in.getUnsignedInt(in.readerIndex() + ProtocolConstant.LENGTH_FIELD_OFFSET);
        if (length > maxFrameSize) {
            throw new FrameDecodeException(FrameDecodeException.Reason.BAD_LENGTH,
                    "payload " + length + " bytes exceeds limit " + maxFrameSize);
        }
        return length;
    }

    /**
     * 写出一帧。Length 字段取实际负载长度，传入的消息头不会被修改
     */
    private void writeFrame(MessageHeader header, byte[] payload, ByteBuf out) {
        if (payload.length > maxFrameSize) {
            throw new IllegalArgumentException("payload " + payload.length + " bytes exceeds limit " + maxFrameSize);
        }
        out.writeInt(header.getMagic());
        out.writeInt(header.getMessageId());
        out.writeInt(header.getMessageType());
        out.writeShort(header.getFlags());
        out.writeLong(header.getPlayerId());
        out.writeLong(header.getTimestamp());
        out.writeInt(header.getSequence());
        out.writeInt(payload.length);
        out.writeBytes(payload);
    }
}
