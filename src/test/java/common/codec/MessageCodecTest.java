package common.codec;

import common.message.GameMessage;
import common.message.MessageFlags;
import common.message.MessageHeader;
import common.message.MessageType;
import common.message.ProtocolConstant;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MessageCodec 编解码测试")
class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    private static MessageHeader header(int messageId, int type) {
        return MessageHeader.builder()
                .magic(ProtocolConstant.MAGIC)
                .messageId(messageId)
                .messageType(type)
                .flags(MessageFlags.REQUEST | MessageFlags.ASYNC)
                .playerId(10086L)
                .timestamp(1_700_000_000_123L)
                .sequence(7)
                .build();
    }

    @Nested
    @DisplayName("编码")
    class Encode {

        @Test
        @DisplayName("头部固定 38 字节，字段按大端序依次写入")
        void shouldWriteHeaderInWireOrder() {
            byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
            byte[] bytes = codec.encode(header(42, MessageType.PLAYER_MOVE), payload);

            assertEquals(ProtocolConstant.HEADER_LENGTH + payload.length, bytes.length);
            ByteBuf buf = Unpooled.wrappedBuffer(bytes);
            assertEquals(0x47574B53, buf.readInt(), "魔数");
            assertEquals(42, buf.readInt(), "消息ID");
            assertEquals(MessageType.PLAYER_MOVE, buf.readInt(), "消息类型");
            assertEquals(MessageFlags.REQUEST | MessageFlags.ASYNC, buf.readUnsignedShort(), "标志位");
            assertEquals(10086L, buf.readLong(), "玩家ID");
            assertEquals(1_700_000_000_123L, buf.readLong(), "时间戳");
            assertEquals(7, buf.readInt(), "序号");
            assertEquals(payload.length, buf.readInt(), "长度");
        }

        @Test
        @DisplayName("Length 字段总是以实际负载为准")
        void shouldOverrideDeclaredLength() {
            MessageHeader h = header(1, MessageType.HEARTBEAT);
            h.setLength(999);
            byte[] bytes = codec.encode(h, new byte[3]);
            assertEquals(3, Unpooled.wrappedBuffer(bytes).getInt(ProtocolConstant.LENGTH_FIELD_OFFSET));
        }

        @Test
        @DisplayName("编码不修改传入的消息头")
        void shouldNotMutateHeader() {
            MessageHeader h = header(1, MessageType.HEARTBEAT);
            h.setLength(999);
            MessageHeader before = h.toBuilder().build();

            codec.encode(h, new byte[3]);
            codec.encode(GameMessage.of(h.toBuilder().build(), new byte[5]), Unpooled.buffer());

            assertEquals(before, h);
            assertEquals(999, h.getLength());
        }

        @Test
        @DisplayName("负载超过上限时拒绝编码")
        void shouldRejectOversizedPayload() {
            MessageCodec small = new MessageCodec(16);
            assertThrows(IllegalArgumentException.class, () -> small.encode(header(1, 1), new byte[17]));
        }
    }

    @Nested
    @DisplayName("解码")
    class Decode {

        @Test
        @DisplayName("decode(encode(h, p)) 还原头部与负载")
        void shouldRoundTrip() {
            byte[] payload = "{\"x\":1}".getBytes(StandardCharsets.UTF_8);
            MessageHeader original = header(42, MessageType.CHAT_MESSAGE);

            GameMessage decoded = codec.decode(codec.encode(original, payload));

            assertEquals(original.toBuilder().length(payload.length).build(), decoded.getHeader());
            assertEquals(payload.length, decoded.getHeader().getLength());
            assertArrayEquals(payload, decoded.getPayload());
        }

        @Test
        @DisplayName("空负载也能往返")
        void shouldRoundTripEmptyPayload() {
            GameMessage decoded = codec.decode(codec.encode(header(5, MessageType.PING), null));
            assertEquals(0, decoded.getPayload().length);
            assertEquals(MessageType.PING, decoded.getMessageType());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 4, 37})
        @DisplayName("不足一个头部时报 SHORT_BUFFER")
        void shouldRejectShortBuffer(int size) {
            byte[] frame = Arrays.copyOf(codec.encode(header(1, 1), new byte[8]), size);
            FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(frame));
            assertEquals(FrameDecodeException.Reason.SHORT_BUFFER, e.getReason());
        }

        @Test
        @DisplayName("不足一个头部但已有 4 字节时，魔数错误优先于 SHORT_BUFFER")
        void shouldRejectBadMagicInShortBuffer() {
            byte[] bytes = Arrays.copyOf(codec.encode(header(1, 1), new byte[0]), 10);
            bytes[0] = 0x00;

            FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(bytes));
            assertEquals(FrameDecodeException.Reason.BAD_MAGIC, e.getReason());
        }

        @Test
        @DisplayName("魔数错误时报 BAD_MAGIC，且先于长度校验")
        void shouldRejectBadMagicFirst() {
            byte[] bytes = codec.encode(header(1, 1), new byte[4]);
            bytes[0] = 0x00;
            // 同时把长度改成超大值，仍应先报魔数错误
            Unpooled.wrappedBuffer(bytes).setInt(ProtocolConstant.LENGTH_FIELD_OFFSET, Integer.MAX_VALUE);

            FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(bytes));
            assertEquals(FrameDecodeException.Reason.BAD_MAGIC, e.getReason());
        }

        @Test
        @DisplayName("声明长度超过上限时报 BAD_LENGTH")
        void shouldRejectOversizedLength() {
            byte[] bytes = codec.encode(header(1, 1), new byte[0]);
            Unpooled.wrappedBuffer(bytes).setInt(ProtocolConstant.LENGTH_FIELD_OFFSET, ProtocolConstant.DEFAULT_MAX_FRAME_SIZE + 1);

            FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(bytes));
            assertEquals(FrameDecodeException.Reason.BAD_LENGTH, e.getReason());
        }

        @Test
        @DisplayName("负载不完整时报 SHORT_BUFFER")
        void shouldRejectTruncatedPayload() {
            byte[] bytes = codec.encode(header(1, 1), new byte[10]);
            byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);

            FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(truncated));
            assertEquals(FrameDecodeException.Reason.SHORT_BUFFER, e.getReason());
        }

        @Test
        @DisplayName("从 ByteBuf 解码后读指针停在帧末尾")
        void shouldAdvanceReaderIndexByOneFrame() {
            ByteBuf buf = Unpooled.buffer();
            buf.writeBytes(codec.encode(header(1, 1), new byte[2]));
            buf.writeBytes(codec.encode(header(2, 1), new byte[3]));

            assertEquals(1, codec.decode(buf).getMessageId());
            assertEquals(2, codec.decode(buf).getMessageId());
            assertFalse(buf.isReadable());
        }
    }
}
