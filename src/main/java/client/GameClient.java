package client;

import client.netty.PendingRequests;
import client.netty.initializer.NettyClientInitializer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import common.codec.MessageCodec;
import common.message.GameMessage;
import common.message.MessageType;
import common.message.payload.AuthRequest;
import common.serializer.JsonSerializer;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 网关客户端，用于联调工具和集成测试。
 * 请求与响应按消息ID关联，服务端的 PING 探测默认自动回复。
 */
public class GameClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(GameClient.class);

    // 所有客户端共用的超时调度器
    private static final ScheduledExecutorService SCHEDULER = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("game-client-timeout-%d").setDaemon(true).build());

    private final String host;
    private final int port;
    private final long requestTimeoutMillis;
    private final EventLoopGroup eventLoopGroup;
    private final Bootstrap bootstrap;
    private final PendingRequests pendingRequests = new PendingRequests();
    private final List<Consumer<GameMessage>> pushListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger messageIds = new AtomicInteger();
    private volatile Channel channel;

    public GameClient(String host, int port) {
        this(host, port, 5000, true);
    }

    public GameClient(String host, int port, long requestTimeoutMillis, boolean autoPong) {
        this.host = host;
        this.port = port;
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.eventLoopGroup = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();
        this.bootstrap.group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3000)
                .handler(new NettyClientInitializer(new MessageCodec(), pendingRequests, autoPong, this::onPush));
    }

    public void connect() throws InterruptedException {
        channel = bootstrap.connect(host, port).sync().channel();
        logger.info("已连接到服务端 {}:{}", host, port);
    }

    public boolean isConnected() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    public int nextMessageId() {
        return messageIds.incrementAndGet();
    }

    /**
     * 只发送不等待响应
     */
    public ChannelFuture send(GameMessage message) {
        return requireChannel().writeAndFlush(message);
    }

    /**
     * 发送请求并等待同一消息ID的响应，超时后 future 以 {@link TimeoutException} 结束
     */
    public CompletableFuture<GameMessage> request(GameMessage message) {
        CompletableFuture<GameMessage> future = new CompletableFuture<>();
        int messageId = message.getMessageId();
        pendingRequests.put(messageId, future);

        Channel ch;
        try {
            ch = requireChannel();
        } catch (IllegalStateException e) {
            pendingRequests.fail(messageId, e);
            return future;
        }
        ch.writeAndFlush(message).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                logger.error("发送请求失败, id={}", messageId, f.cause());
                pendingRequests.fail(messageId, f.cause());
            }
        });
        SCHEDULER.schedule(() -> {
            if (!future.isDone()) {
                logger.warn("请求超时: type={}, id={}", message.getMessageType(), messageId);
                pendingRequests.fail(messageId, new TimeoutException("request " + messageId + " timed out"));
            }
        }, requestTimeoutMillis, TimeUnit.MILLISECONDS);
        return future;
    }

    public CompletableFuture<GameMessage> request(int messageType, Object payload) {
        return request(GameMessage.request(messageType, nextMessageId(), JsonSerializer.serialize(payload)));
    }

    public CompletableFuture<GameMessage> handshake() {
        return request(MessageType.HANDSHAKE, null);
    }

    public CompletableFuture<GameMessage> authenticate(String token) {
        return request(MessageType.AUTH, new AuthRequest(token));
    }

    public CompletableFuture<GameMessage> heartbeat() {
        return request(MessageType.HEARTBEAT, null);
    }

    /**
     * 注册推送回调，接收非响应类消息，例如下线通知
     */
    public void addPushListener(Consumer<GameMessage> listener) {
        pushListeners.add(listener);
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
            channel = null;
        }
        eventLoopGroup.shutdownGracefully();
        logger.info("客户端已关闭");
    }

    private Channel requireChannel() {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IllegalStateException("not connected to " + host + ":" + port);
        }
        return ch;
    }

    private void onPush(GameMessage message) {
        for (Consumer<GameMessage> listener : pushListeners) {
            listener.accept(message);
        }
    }
}
