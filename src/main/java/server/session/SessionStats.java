package server.session;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * 会话统计快照
 */
@Getter
@Builder
@ToString
public class SessionStats {
    private final int totalSessions;
    private final int activeSessions;
    private final int boundPlayers;
    private final long sessionsCreated;
    private final long sessionsRemoved;
    private final long sessionsEvicted;
    private final long sessionsReplaced;
    private final Map<SessionState, Integer> stateCounts;
}
