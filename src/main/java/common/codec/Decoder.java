package common.codec;

import common.message.ProtocolConstant;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * 流式拆帧解码器，自行处理粘包/拆包。
 *
 * <p>收到 4 个字节即校验魔数，收齐头部后校验长度，
 * 两者任一失败都会抛出 {@link FrameDecodeException}，由上层关闭连接。</p>
 */
public class Decoder extends ByteToMessageDecoder {
    private final MessageCodec codec;

    public Decoder(MessageCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < Integer.BYTES) {
            return;
        }
        codec.checkMagic(in);

        if (in.readableBytes() < ProtocolConstant.HEADER_LENGTH) {
            return;
        }
        long length = codec.checkLength(in);

        if (in.readableBytes() < ProtocolConstant.HEADER_LENGTH + length) {
            return;
        }
        out.add(codec.decode(in));
    }
}
