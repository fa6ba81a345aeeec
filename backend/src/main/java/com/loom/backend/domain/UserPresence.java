package com.loom.backend.domain;

import java.time.Instant;

/**
 * 한 사용자가 room 안에서 가진 현재 상태.
 * 변경은 항상 새 값을 만들어 교체한다(copy-with-change).
 */
public record UserPresence(
        String userId,
        String userName,
        String userColor,   // hex, cursor/selection 표시용
        Instant joinedAt,
        Instant lastActive,
        double cursorX,
        double cursorY,
        String selectedNodeId,
        String editingNodeId,
        boolean active
) {

    public static UserPresence joined(String userId, String userName, String userColor, Instant now) {
        return new UserPresence(userId, userName, userColor, now, now, 0.0, 0.0, null, null, true);
    }

    public UserPresence withCursor(double x, double y, Instant now) {
        return new UserPresence(userId, userName, userColor, joinedAt, now,
                x, y, selectedNodeId, editingNodeId, active);
    }

    public UserPresence withSelectedNode(String nodeId, Instant now) {
        return new UserPresence(userId, userName, userColor, joinedAt, now,
                cursorX, cursorY, nodeId, editingNodeId, active);
    }

    public UserPresence withEditingNode(String nodeId, Instant now) {
        return new UserPresence(userId, userName, userColor, joinedAt, now,
                cursorX, cursorY, selectedNodeId, nodeId, active);
    }

    /** leave 시점의 비활성 사본. cursor/selection은 초기화된다. */
    public UserPresence deactivated(Instant now) {
        return new UserPresence(userId, userName, userColor, joinedAt, now,
                0.0, 0.0, null, null, false);
    }
}
