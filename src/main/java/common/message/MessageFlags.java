package common.message;

/**
 * 消息标志位
 */
public final class MessageFlags {
    public static final int REQUEST = 0x0001;
    public static final int RESPONSE = 0x0002;
    public static final int ERROR = 0x0004;
    public static final int ASYNC = 0x0008;
    public static final int BROADCAST = 0x0010;
    public static final int ENCRYPTED = 0x0020;
    public static final int COMPRESSED = 0x0040;

    private MessageFlags() {}

    public static boolean has(int flags, int flag) {
        return (flags & flag) == flag;
    }

    public static int set(int flags, int flag) {
        return (flags | flag) & 0xFFFF;
    }

    public static int clear(int flags, int flag) {
        return flags & ~flag & 0xFFFF;
    }
}
