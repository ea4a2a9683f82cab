package common.message;

/**
 * 消息类型常量
 */
public final class MessageType {

    // 系统消息 (0x0000 - 0x00FF)
    public static final int HEARTBEAT = 0x0001;
    public static final int HANDSHAKE = 0x0002;
    public static final int AUTH = 0x0003;
    public static final int DISCONNECT = 0x0004;
    public static final int ERROR = 0x0005;
    public static final int PING = 0x0006;
    public static final int PONG = 0x0007;

    // 玩家 (0x0100 - 0x01FF)
    public static final int PLAYER_LOGIN = 0x0101;
    public static final int PLAYER_LOGOUT = 0x0102;
    public static final int PLAYER_INFO = 0x0103;
    public static final int PLAYER_MOVE = 0x0104;
    public static final int PLAYER_STATUS = 0x0108;

    // 战斗 (0x0200 - 0x02FF)
    public static final int BATTLE_CREATE = 0x0201;
    public static final int BATTLE_JOIN = 0x0202;
    public static final int BATTLE_LEAVE = 0x0203;
    public static final int BATTLE_ACTION = 0x0206;
    public static final int SKILL_CAST = 0x0209;

    // 宠物 (0x0300 - 0x03FF)
    public static final int PET_SUMMON = 0x0301;
    public static final int PET_DISMISS = 0x0302;
    public static final int PET_EVOLUTION = 0x0307;

    // 建筑 (0x0400 - 0x04FF)
    public static final int BUILDING_CREATE = 0x0401;
    public static final int BUILDING_UPGRADE = 0x0402;

    // 社交 (0x0500 - 0x05FF)
    public static final int CHAT_MESSAGE = 0x0501;
    public static final int FRIEND_REQUEST = 0x0502;
    public static final int GUILD_JOIN = 0x0508;

    // 物品 (0x0600 - 0x06FF)
    public static final int ITEM_USE = 0x0601;
    public static final int ITEM_EQUIP = 0x0602;

    // 任务 (0x0700 - 0x07FF)
    public static final int QUEST_ACCEPT = 0x0701;
    public static final int QUEST_COMPLETE = 0x0702;

    // 查询 (0x0800 - 0x08FF)
    public static final int GET_PLAYER_INFO = 0x0801;
    public static final int GET_ONLINE_PLAYERS = 0x0802;
    public static final int GET_SERVER_INFO = 0x0805;

    private MessageType() {}

    public static boolean isSystem(int messageType) {
        return MessageCategory.of(messageType) == MessageCategory.SYSTEM;
    }
}
