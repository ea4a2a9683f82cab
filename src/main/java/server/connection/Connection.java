package server.connection;

import common.message.GameMessage;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一条传输层连接，包装 Netty Channel。
 *
 * <p>出站写入经过一个有界计数：已提交但尚未写出的消息数超过上限时，
 * 连接被视为无法跟上并直接关闭。</p>
 */
public class Connection {
    private static final Logger logger = LoggerFactory.getLogger(Connection.class);

    @Getter
    private final String id;
    @Getter
    private final Channel channel;
    @Getter
    private final String remoteAddress;
    @Getter
    private final Instant createdAt;
    @Getter
    private volatile Instant lastActivity;

    private final Clock clock;
    private final int outboundQueueCapacity;
    private final AtomicInteger pendingWrites = new AtomicInteger();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicReference<ConnectionStatus> status = new AtomicReference<>(ConnectionStatus.ACTIVE);
    private final Set<String> groups = ConcurrentHashMap.newKeySet();

    public Connection(String id, Channel channel, int outboundQueueCapacity, Clock clock) {
        this.id = id;
        this.channel = channel;
        this.outboundQueueCapacity = outboundQueueCapacity;
        this.clock = clock;
        SocketAddress address = channel.remoteAddress();
        this.remoteAddress = address != null ? address.toString() : "unknown";
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
    }

    /**
     * 以 Channel 的全局唯一长ID作为连接ID。短ID只有 32 位随机数，不能用作注册表的键
     */
    public static Connection of(Channel channel, int outboundQueueCapacity, Clock clock) {
        return new Connection(channel.id().asLongText(), channel, outboundQueueCapacity, clock);
    }

    /**
     * 异步发送一条消息。
     *
     * @throws ConnectionClosedException 连接已关闭
     * @throws OutboundQueueFullException 待写出消息超过上限，连接已被关闭
     */
    public void send(GameMessage message) throws ConnectionException {
        if (!isActive()) {
            throw new ConnectionClosedException(id);
        }
        if (pendingWrites.incrementAndGet() > outboundQueueCapacity) {
            pendingWrites.decrementAndGet();
            logger.warn("连接 {} 发送队列已满({}), 关闭连接", id, outboundQueueCapacity);
            close();
            throw new OutboundQueueFullException(id, outboundQueueCapacity);
        }
        channel.writeAndFlush(message).addListener((ChannelFutureListener) future -> {
            pendingWrites.decrementAndGet();
            if (!future.isSuccess()) {
                logger.warn("连接 {} 写出消息失败, type={}, id={}: {}", id,
                        message.getMessageType(), message.getMessageId(),
                        future.cause() != null ? future.cause().getMessage() : "cancelled");
            }
        });
    }

    public void touch() {
        lastActivity = clock.instant();
    }

    public boolean isActive() {
        return status.get() == ConnectionStatus.ACTIVE && channel.isActive();
    }

    public ConnectionStatus getStatus() {
        return status.get();
    }

    public int getPendingWrites() {
        return pendingWrites.get();
    }

    public int nextSequence() {
        return sequence.incrementAndGet();
    }

    /**
     * 关闭连接，重复调用无副作用
     */
    public void close() {
        if (status.compareAndSet(ConnectionStatus.ACTIVE, ConnectionStatus.CLOSED)) {
            channel.close();
            logger.debug("连接已关闭: {} ({})", id, remoteAddress);
        }
    }

    void addGroup(String groupId) {
        groups.add(groupId);
    }

    void removeGroup(String groupId) {
        groups.remove(groupId);
    }

    public Set<String> getGroups() {
        return Collections.unmodifiableSet(groups);
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", remote=" + remoteAddress + ", status=" + status.get() + "}";
    }
}
