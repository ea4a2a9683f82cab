package server.netty.initializer;

import common.codec.Decoder;
import common.codec.Encoder;
import common.codec.MessageCodec;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.AllArgsConstructor;
import server.GameGateway;
import server.netty.handler.NettyServerHandler;

@AllArgsConstructor
public class NettyServerInitializer extends ChannelInitializer<SocketChannel> {
    private final GameGateway gateway;
    private final MessageCodec codec;
    private final EventExecutorGroup businessGroup;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        // 解码器自行拆帧：先校验魔数，再校验长度，收齐整帧后才输出
        pipeline.addLast("decoder", new Decoder(codec));
        pipeline.addLast("encoder", new Encoder(codec));
        // 业务处理放到独立线程组，每个 Channel 固定在同一个执行器上，消息顺序不变
        pipeline.addLast(businessGroup, "handler", new NettyServerHandler(gateway));
    }
}
