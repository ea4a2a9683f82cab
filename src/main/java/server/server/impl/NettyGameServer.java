package server.server.impl;

import common.codec.MessageCodec;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.GameGateway;
import server.config.ServerConfig;
import server.netty.initializer.NettyServerInitializer;
import server.server.GameServer;

import java.net.InetSocketAddress;

/**
 * 基于 Netty 的游戏网关服务端
 */
public class NettyGameServer implements GameServer {
    private static final Logger logger = LoggerFactory.getLogger(NettyGameServer.class);

    private final GameGateway gateway;
    private final ServerConfig config;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup businessGroup;
    private Channel serverChannel;
    private int port;

    public NettyGameServer(GameGateway gateway) {
        this.gateway = gateway;
        this.config = gateway.getConfig();
    }

    @Override
    public synchronized void start(int port) throws InterruptedException {
        if (serverChannel != null) {
            logger.warn("服务器已经在运行中, 端口: {}", this.port);
            return;
        }
        /*
         * bossGroup 负责接受连接，workerGroup 负责读写与编解码，
         * businessGroup 执行路由和业务处理器，避免阻塞 IO 线程。
         */
        bossGroup = new NioEventLoopGroup(config.getBossThreads());
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());
        businessGroup = new DefaultEventExecutorGroup(config.getBusinessThreads());
        MessageCodec codec = new MessageCodec(config.getMaxFrameSize());

        try {
            ServerBootstrap serverBootstrap = new ServerBootstrap();
            serverBootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new NettyServerInitializer(gateway, codec, businessGroup))
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_SNDBUF, 65536)
                    .childOption(ChannelOption.SO_RCVBUF, 65536);

            ChannelFuture channelFuture = serverBootstrap.bind(config.getHost(), port).sync();
            serverChannel = channelFuture.channel();
            this.port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        } catch (InterruptedException e) {
            logger.error("服务器启动被中断: {}", e.getMessage());
            shutdownGroups();
            throw e;
        }

        gateway.start();
        logger.info("游戏网关已启动，监听 {}:{}", config.getHost(), this.port);
    }

    @Override
    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        logger.info("正在停止游戏网关...");
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        gateway.stop();
        shutdownGroups();
        logger.info("游戏网关已完全停止");
    }

    public int getPort() {
        return port;
    }

    public GameGateway getGateway() {
        return gateway;
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (businessGroup != null) {
            businessGroup.shutdownGracefully();
        }
        try {
            if (bossGroup != null) {
                bossGroup.terminationFuture().sync();
            }
            if (workerGroup != null) {
                workerGroup.terminationFuture().sync();
            }
            if (businessGroup != null) {
                businessGroup.terminationFuture().sync();
            }
        } catch (InterruptedException e) {
            logger.error("关闭线程组时被中断: {}", e.getMessage(), e);
            Thread.currentThread().interrupt();
        }
        bossGroup = null;
        workerGroup = null;
        businessGroup = null;
    }
}
