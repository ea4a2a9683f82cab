package common.codec;

import common.message.GameMessage;
import common.message.MessageHeader;
import common.message.MessageType;
import common.message.ProtocolConstant;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Decoder/Encoder 流水线测试")
class DecoderTest {

    private MessageCodec codec;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        codec = new MessageCodec(1024);
        channel = new EmbeddedChannel(new Decoder(codec), new Encoder(codec));
    }

    private byte[] frame(int messageId, int payloadSize) {
        MessageHeader header = MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(messageId)
                .messageType(MessageType.PLAYER_MOVE)
                .timestamp(System.currentTimeMillis())
                .build();
        return codec.encode(header, new byte[payloadSize]);
    }

    @Test
    @DisplayName("拆包：分段到达的帧在收齐后只输出一条消息")
    void shouldReassembleSplitFrame() {
        byte[] bytes = frame(42, 20);

        assertFalse(channel.writeInbound(Unpooled.wrappedBuffer(bytes, 0, 3)));
        assertFalse(channel.writeInbound(Unpooled.wrappedBuffer(bytes, 3, 30)));
        assertFalse(channel.writeInbound(Unpooled.wrappedBuffer(bytes, 33, 10)));
        assertTrue(channel.writeInbound(Unpooled.wrappedBuffer(bytes, 43, bytes.length - 43)));

        GameMessage msg = channel.readInbound();
        assertEquals(42, msg.getMessageId());
        assertEquals(20, msg.getPayload().length);
        assertNull(channel.readInbound());
    }

    @Test
    @DisplayName("粘包：一次到达的多帧依次输出")
    void shouldSplitCoalescedFrames() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeBytes(frame(1, 0));
        buf.writeBytes(frame(2, 5));
        buf.writeBytes(frame(3, 1));

        assertTrue(channel.writeInbound(buf));

        assertEquals(1, ((GameMessage) channel.readInbound()).getMessageId());
        assertEquals(2, ((GameMessage) channel.readInbound()).getMessageId());
        assertEquals(3, ((GameMessage) channel.readInbound()).getMessageId());
    }

    @Test
    @DisplayName("前 4 个字节魔数错误时立即失败，不等待完整头部")
    void shouldFailFastOnBadMagic() {
        ByteBuf junk = Unpooled.buffer().writeInt(0x12345678);

        FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> channel.writeInbound(junk));
        assertEquals(FrameDecodeException.Reason.BAD_MAGIC, e.getReason());
    }

    @Test
    @DisplayName("头部声明的长度超过上限时不等待负载")
    void shouldFailOnOversizedLengthWithHeaderOnly() {
        byte[] bytes = frame(1, 0);
        Unpooled.wrappedBuffer(bytes).setInt(ProtocolConstant.LENGTH_FIELD_OFFSET, 4096);

        FrameDecodeException e = assertThrows(FrameDecodeException.class,
                () -> channel.writeInbound(Unpooled.wrappedBuffer(bytes)));
        assertEquals(FrameDecodeException.Reason.BAD_LENGTH, e.getReason());
    }

    @Test
    @DisplayName("编码器输出的字节可以被解码器还原")
    void shouldEncodeOutboundMessages() {
        GameMessage out = GameMessage.request(MessageType.HEARTBEAT, 9, new byte[]{1, 2, 3});
        assertTrue(channel.writeOutbound(out));

        ByteBuf encoded = channel.readOutbound();
        GameMessage back = codec.decode(encoded);
        encoded.release();
        assertEquals(9, back.getMessageId());
        assertArrayEquals(new byte[]{1, 2, 3}, back.getPayload());
    }
}
