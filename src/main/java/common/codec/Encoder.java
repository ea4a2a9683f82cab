package common.codec;

import common.message.GameMessage;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 将 GameMessage 编码为网络字节流
 */
public class Encoder extends MessageToByteEncoder<GameMessage> {
    private static final Logger logger = LoggerFactory.getLogger(Encoder.class);
    private final MessageCodec codec;

    public Encoder(MessageCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, GameMessage msg, ByteBuf out) {
        try {
            codec.encode(msg, out);
        } catch (Exception e) {
            logger.error("CORE-ENCODER: 编码消息失败, type={}, id={}: {}",
                    msg.getMessageType(), msg.getMessageId(), e.getMessage());
            throw e;
        }
    }
}
