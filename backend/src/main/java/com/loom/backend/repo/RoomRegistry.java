package com.loom.backend.repo;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * roomId -> room. room 생성/삭제는 모두 registry lock 하나로 직렬화한다.
 */
@Component
public class RoomRegistry {
    private final ConcurrentHashMap<String, CollaborationRoom> rooms = new ConcurrentHashMap<>();
    // userId -> roomId (마지막으로 join한 room)
    private final ConcurrentHashMap<String, String> userRooms = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public RoomRegistry(Clock clock) {
        this.clock = clock;
    }

    public CollaborationRoom createRoom(String roomId) {
        return withRegistryLock(() ->
                rooms.computeIfAbsent(roomId, id -> new CollaborationRoom(id, clock.instant())));
    }

    public Optional<CollaborationRoom> getRoom(String roomId) {
        if (roomId == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * engine의 leave 경로에서만 호출된다.
     */
    public void removeRoom(String roomId) {
        withRegistryLock(() -> {
            rooms.remove(roomId);
            userRooms.values().removeIf(roomId::equals);
            return null;
        });
    }

    public <T> T withRegistryLock(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    public void bindUser(String userId, String roomId) {
        userRooms.put(userId, roomId);
    }

    public void unbindUser(String userId, String roomId) {
        userRooms.remove(userId, roomId);
    }

    public Optional<String> roomOf(String userId) {
        return Optional.ofNullable(userRooms.get(userId));
    }

    public Set<String> roomIds() {
        return Set.copyOf(rooms.keySet());
    }

    public int size() {
        return rooms.size();
    }
}
