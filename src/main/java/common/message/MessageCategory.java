package common.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 消息类型分段，每个子系统占用 256 个编号
 */
@Getter
@AllArgsConstructor
public enum MessageCategory {
    SYSTEM(0x0000, 0x00FF),
    PLAYER(0x0100, 0x01FF),
    BATTLE(0x0200, 0x02FF),
    PET(0x0300, 0x03FF),
    BUILDING(0x0400, 0x04FF),
    SOCIAL(0x0500, 0x05FF),
    ITEM(0x0600, 0x06FF),
    QUEST(0x0700, 0x07FF),
    QUERY(0x0800, 0x08FF),
    UNKNOWN(-1, -1);

    private final int start;
    private final int end;

    public boolean contains(int messageType) {
        return messageType >= start && messageType <= end;
    }

    // 根据消息类型定位所属分段
    public static MessageCategory of(int messageType) {
        for (MessageCategory category : values()) {
            if (category != UNKNOWN && category.contains(messageType)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
