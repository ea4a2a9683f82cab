package client.netty.initializer;

import client.netty.PendingRequests;
import client.netty.handler.NettyClientHandler;
import common.codec.Decoder;
import common.codec.Encoder;
import common.codec.MessageCodec;
import common.message.GameMessage;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import lombok.AllArgsConstructor;

import java.util.function.Consumer;

@AllArgsConstructor
public class NettyClientInitializer extends ChannelInitializer<SocketChannel> {
    private final MessageCodec codec;
    private final PendingRequests pendingRequests;
    private final boolean autoPong;
    private final Consumer<GameMessage> pushListener;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        // 与服务端使用同一套编解码
        pipeline.addLast(new Decoder(codec));
        pipeline.addLast(new Encoder(codec));
        pipeline.addLast(new NettyClientHandler(pendingRequests, autoPong, pushListener));
    }
}
