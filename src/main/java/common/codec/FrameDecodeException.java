package common.codec;

import io.netty.handler.codec.CorruptedFrameException;
import lombok.Getter;

/**
 * 帧级错误。对端已不可信，连接应直接关闭且不回包。
 */
@Getter
public class FrameDecodeException extends CorruptedFrameException {

    public enum Reason {
        // 可读字节不足一个完整帧
        SHORT_BUFFER,
        // 魔数不匹配
        BAD_MAGIC,
        // 声明的负载长度超过上限
        BAD_LENGTH
    }

    private final Reason reason;

    public FrameDecodeException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }
}
