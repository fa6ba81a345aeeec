package com.loom.backend.domain;

import java.time.Instant;
import java.util.List;

/**
 * 새로 들어왔거나 재접속한 client를 현재 상태로 맞추기 위한 스냅샷.
 */
public record PresenceSnapshot(
        List<UserEntry> users,
        List<LockEntry> locks
) {
    public record UserEntry(
            String userId,
            String userName,
            String userColor,
            double cursorX,
            double cursorY,
            String selectedNodeId,
            String editingNodeId
    ) {
        public static UserEntry of(UserPresence p) {
            return new UserEntry(p.userId(), p.userName(), p.userColor(),
                    p.cursorX(), p.cursorY(), p.selectedNodeId(), p.editingNodeId());
        }
    }

    public record LockEntry(
            String nodeId,
            String userId,
            String userName,
            Instant expiresAt
    ) {
        public static LockEntry of(EditLock lock) {
            return new LockEntry(lock.nodeId(), lock.userId(), lock.userName(), lock.expiresAt());
        }
    }

    public static PresenceSnapshot empty() {
        return new PresenceSnapshot(List.of(), List.of());
    }
}
