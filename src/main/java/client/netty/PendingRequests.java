package client.netty;

import common.message.GameMessage;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 等待响应的请求，按消息ID关联
 */
public class PendingRequests {
    private final Map<Integer, CompletableFuture<GameMessage>> futureMap = new ConcurrentHashMap<>();

    public void put(int messageId, CompletableFuture<GameMessage> future) {
        futureMap.put(messageId, future);
    }

    /**
     * @return 是否有请求在等待这条响应
     */
    public boolean complete(GameMessage response) {
        CompletableFuture<GameMessage> future = futureMap.remove(response.getMessageId());
        if (future != null) {
            future.complete(response);
            return true;
        }
        return false;
    }

    public void fail(int messageId, Throwable t) {
        CompletableFuture<GameMessage> future = futureMap.remove(messageId);
        if (future != null) {
            future.completeExceptionally(t);
        }
    }

    public void failAll(Throwable t) {
        for (Integer messageId : futureMap.keySet()) {
            fail(messageId, t);
        }
    }

    public int size() {
        return futureMap.size();
    }
}
