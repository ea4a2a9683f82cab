package server.router;

import common.message.ErrorCode;
import common.message.GameMessage;
import common.message.MessageCategory;
import common.message.MessageType;
import common.message.ProtocolConstant;
import common.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import server.config.ServerConfig;
import server.connection.ConnectionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 消息路由器，按消息类型把消息分发给注册的处理器。
 *
 * <p>同一类型重复注册时以最后一次为准。处理器在调用方线程上执行，
 * 同一连接的消息顺序由调用方保证。</p>
 */
public class Router {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    private final Map<Integer, MessageHandler> handlers = new ConcurrentHashMap<>();
    private final boolean requireAuthentication;
    private final MetricsSink metrics;

    public Router(ServerConfig config, MetricsSink metrics) {
        this.requireAuthentication = config.isRequireAuthentication();
        this.metrics = metrics;
    }

    public void registerHandler(int messageType, MessageHandler handler) {
        MessageHandler previous = handlers.put(messageType, handler);
        if (previous != null && previous != handler) {
            logger.warn("消息类型 0x{} 的处理器被覆盖: {} -> {}", Integer.toHexString(messageType),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            logger.debug("注册消息处理器: 0x{} ({})", Integer.toHexString(messageType), MessageCategory.of(messageType));
        }
    }

    public void unregisterHandler(int messageType) {
        if (handlers.remove(messageType) != null) {
            logger.info("注销消息处理器: 0x{}", Integer.toHexString(messageType));
        }
    }

    public MessageHandler getHandler(int messageType) {
        return handlers.get(messageType);
    }

    public List<Integer> getRegisteredMessageTypes() {
        List<Integer> types = new ArrayList<>(handlers.keySet());
        Collections.sort(types);
        return types;
    }

    public int getHandlerCount() {
        return handlers.size();
    }

    public boolean isMessageTypeSupported(int messageType) {
        return handlers.containsKey(messageType);
    }

    /**
     * 校验消息头的基本字段
     *
     * @throws InvalidMessageException 任一字段非法
     */
    public void validateMessage(GameMessage message) throws InvalidMessageException {
        if (message == null || message.getHeader() == null) {
            throw new InvalidMessageException("message is null", 0, 0);
        }
        int type = message.getMessageType();
        int id = message.getMessageId();
        if (message.getHeader().getMagic() != ProtocolConstant.MAGIC) {
            throw new InvalidMessageException("invalid magic number: " + message.getHeader().getMagic(), type, id);
        }
        if (type == 0) {
            throw new InvalidMessageException("invalid message type: " + type, type, id);
        }
        if (id == 0) {
            throw new InvalidMessageException("invalid message ID: " + id, type, id);
        }
        if (message.getHeader().getTimestamp() <= 0) {
            throw new InvalidMessageException("invalid timestamp: " + message.getHeader().getTimestamp(), type, id);
        }
    }

    /**
     * 路由一条消息。
     *
     * <ol>
     *   <li>校验失败：回复 INVALID_MESSAGE 后抛出 {@link InvalidMessageException}</li>
     *   <li>没有处理器：回复 UNHANDLED_MESSAGE，正常返回</li>
     *   <li>未认证会话发送非系统消息：回复 NOT_AUTHENTICATED，正常返回</li>
     *   <li>处理器抛出异常：记录日志后以 {@link HandlerException} 抛出</li>
     * </ol>
     *
     * @throws ConnectionException 回复时连接已关闭或发送队列已满
     */
    public void routeMessage(SessionContext context, GameMessage message) throws RoutingException, ConnectionException {
        metrics.incCounter("router.received");
        try {
            validateMessage(message);
        } catch (InvalidMessageException e) {
            metrics.incCounter("router.invalid");
            logger.warn("会话 {} 收到非法消息: {}", context.getSessionId(), e.getMessage());
            if (message != null && message.getHeader() != null) {
                try {
                    context.replyError(message, ErrorCode.INVALID_MESSAGE, e.getMessage());
                } catch (ConnectionException ce) {
                    logger.warn("回复非法消息错误失败, 会话 {}: {}", context.getSessionId(), ce.getMessage());
                }
            }
            throw e;
        }

        int type = message.getMessageType();
        MessageHandler handler = handlers.get(type);
        if (handler == null) {
            metrics.incCounter("router.unhandled");
            logger.warn("没有找到消息处理器: type=0x{}, id={}, 会话 {}",
                    Integer.toHexString(type), message.getMessageId(), context.getSessionId());
            context.replyError(message, ErrorCode.UNHANDLED_MESSAGE,
                    "No handler registered for message type: " + type);
            return;
        }

        if (requireAuthentication && !MessageType.isSystem(type) && !context.isAuthenticated()) {
            metrics.incCounter("router.unauthenticated");
            logger.warn("未认证会话 {} 发送业务消息 type=0x{}, 已拒绝", context.getSessionId(), Integer.toHexString(type));
            context.replyError(message, ErrorCode.NOT_AUTHENTICATED, "Session is not authenticated");
            return;
        }

        long start = System.nanoTime();
        try {
            handler.handle(context, message);
            metrics.incCounter("router.handled");
        } catch (ConnectionException e) {
            metrics.incCounter("router.connection_lost");
            logger.warn("处理消息时连接不可用, 会话 {}, type=0x{}, id={}: {}", context.getSessionId(),
                    Integer.toHexString(type), message.getMessageId(), e.getMessage());
            throw e;
        } catch (Exception e) {
            metrics.incCounter("router.handler_errors");
            logger.error("消息处理失败, 会话: {}, 玩家: {}, type=0x{}, id={}", context.getSessionId(),
                    context.getPlayerId(), Integer.toHexString(type), message.getMessageId(), e);
            if (e instanceof HandlerException) {
                throw (HandlerException) e;
            }
            throw new HandlerException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    type, message.getMessageId(), false, e);
        } finally {
            metrics.observeDuration("router.handle_duration", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * 输出已注册处理器，按分段归类
     */
    public void logStats() {
        Map<MessageCategory, Integer> byCategory = new EnumMap<>(MessageCategory.class);
        for (Integer type : handlers.keySet()) {
            byCategory.merge(MessageCategory.of(type), 1, Integer::sum);
        }
        logger.info("路由器统计: 处理器总数 {}, 分段分布 {}", handlers.size(), byCategory);
    }
}
