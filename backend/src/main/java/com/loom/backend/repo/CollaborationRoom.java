package com.loom.backend.repo;

import com.loom.backend.domain.EditLock;
import com.loom.backend.domain.UserPresence;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 하나의 story/project에 대한 협업 공간. RoomRegistry만 생성/삭제한다.
 * edit lock 획득/해제는 반드시 {@link #lock} 안에서 수행한다.
 */
public class CollaborationRoom {
    private final String roomId;
    private final Instant createdAt;

    // userId -> presence
    public final ConcurrentHashMap<String, UserPresence> users = new ConcurrentHashMap<>();
    // nodeId -> lock
    public final ConcurrentHashMap<String, EditLock> editLocks = new ConcurrentHashMap<>();

    public final ReentrantLock lock = new ReentrantLock();

    public CollaborationRoom(String roomId, Instant createdAt) {
        this.roomId = roomId;
        this.createdAt = createdAt;
    }

    public String getRoomId() {
        return roomId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<UserPresence> getActiveUsers() {
        return users.values().stream()
                .filter(UserPresence::active)
                .toList();
    }

    public int getUserCount() {
        return getActiveUsers().size();
    }
}
