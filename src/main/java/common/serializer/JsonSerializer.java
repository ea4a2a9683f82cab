package common.serializer;

import com.alibaba.fastjson.JSON;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 负载 JSON 序列化工具，基于 fastjson
 */
public final class JsonSerializer {
    private static final Logger logger = LoggerFactory.getLogger(JsonSerializer.class);
    private static final byte[] EMPTY = new byte[0];

    private JsonSerializer() {}

    public static byte[] serialize(Object obj) {
        if (obj == null) {
            return EMPTY;
        }
        if (obj instanceof byte[]) {
            return (byte[]) obj;
        }
        byte[] bytes = JSON.toJSONBytes(obj);
        logger.debug("序列化完成: {}, 数据长度: {}", obj.getClass().getSimpleName(), bytes.length);
        return bytes;
    }

    /**
     * 反序列化负载，负载为空或格式非法时返回 null
     */
    public static <T> T deserialize(byte[] bytes, Class<T> type) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return JSON.parseObject(bytes, type);
        } catch (Exception e) {
            logger.warn("反序列化失败, 目标类型: {}, 原因: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }
}
