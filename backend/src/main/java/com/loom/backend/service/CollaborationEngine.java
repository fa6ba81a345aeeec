package com.loom.backend.service;

import com.loom.backend.domain.CollaborationEvent;
import com.loom.backend.domain.CollaborationEventType;
import com.loom.backend.domain.CursorPosition;
import com.loom.backend.domain.EditLock;
import com.loom.backend.domain.PresenceSnapshot;
import com.loom.backend.domain.UserPresence;
import com.loom.backend.repo.CollaborationRoom;
import com.loom.backend.repo.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 실시간 협업: room 입장/퇴장, cursor/selection, node edit lock.
 *
 * <p>Lock 순서는 항상 registry lock -> room lock. cursor/selection 갱신은 지연을 줄이려고
 * room lock을 타지 않는다(같은 사용자에 대한 동시 갱신은 last-write-wins).
 * 모든 상태 변화는 {@link CollaborationEvent}로 등록 순서대로 listener에게 동기 전달된다.
 */
@Service
public class CollaborationEngine {
    private static final Logger log = LoggerFactory.getLogger(CollaborationEngine.class);

    public static final List<String> USER_COLORS = List.of(
            "#FF6B6B", // red
            "#4ECDC4", // teal
            "#45B7D1", // blue
            "#FFA07A", // light salmon
            "#98D8C8", // mint
            "#F7DC6F", // yellow
            "#BB8FCE", // purple
            "#85C1E2", // light blue
            "#F8B739", // orange
            "#52BE80"  // green
    );

    private final RoomRegistry rooms;
    private final Clock clock;
    private final CopyOnWriteArrayList<CollaborationEventListener> listeners = new CopyOnWriteArrayList<>();

    public CollaborationEngine(RoomRegistry rooms, Clock clock, List<CollaborationEventListener> listeners) {
        this.rooms = rooms;
        this.clock = clock;
        listeners.forEach(this::onEvent);
    }

    public Optional<CollaborationRoom> getRoom(String roomId) {
        return rooms.getRoom(roomId);
    }

    public RoomMembership joinRoom(String roomId, String userId, String userName) {
        return rooms.withRegistryLock(() -> {
            CollaborationRoom room = rooms.createRoom(roomId);
            room.lock.lock();
            try {
                // 비활성 사용자도 map에 남아 있으므로 map 크기 기준으로 순환
                String color = USER_COLORS.get(room.users.size() % USER_COLORS.size());
                Instant now = clock.instant();
                UserPresence presence = UserPresence.joined(userId, userName, color, now);

                room.users.put(userId, presence);
                rooms.bindUser(userId, roomId);
                log.debug("user {} joined room {} as {}", userId, roomId, color);

                broadcast(event(CollaborationEventType.USER_JOINED, roomId, userId, now,
                        "userName", userName,
                        "userColor", color,
                        "userCount", room.getUserCount()));
                return new RoomMembership(room, presence);
            } finally {
                room.lock.unlock();
            }
        });
    }

    /**
     * @return 남아 있는 room, 마지막 활성 사용자가 나가서 room이 삭제됐거나 room이 없으면 empty
     */
    public Optional<CollaborationRoom> leaveRoom(String roomId, String userId) {
        return rooms.withRegistryLock(() -> {
            CollaborationRoom room = rooms.getRoom(roomId).orElse(null);
            if (room == null) return Optional.empty();

            room.lock.lock();
            try {
                UserPresence user = room.users.get(userId);
                if (user != null) {
                    Instant now = clock.instant();
                    room.users.computeIfPresent(userId, (id, p) -> p.deactivated(now));
                    rooms.unbindUser(userId, roomId);

                    releaseUserLocks(room, userId);

                    broadcast(event(CollaborationEventType.USER_LEFT, roomId, userId, now,
                            "userName", user.userName(),
                            "userCount", room.getUserCount()));
                    log.debug("user {} left room {}", userId, roomId);
                }

                if (room.getUserCount() == 0) {
                    rooms.removeRoom(roomId);
                    log.debug("room {} closed", roomId);
                    return Optional.empty();
                }
                return Optional.of(room);
            } finally {
                room.lock.unlock();
            }
        });
    }

    public void updateCursor(String roomId, String userId, double x, double y, String nodeId) {
        CollaborationRoom room = rooms.getRoom(roomId).orElse(null);
        if (room == null) return;

        Instant now = clock.instant();
        // key 단위로 원자적 갱신: 그 사이 leave한 사용자를 다시 살리지 않는다
        UserPresence user = room.users.computeIfPresent(userId, (id, p) ->
                p.active() ? p.withCursor(x, y, now) : p);
        if (user == null || !user.active()) return;

        CursorPosition pos = new CursorPosition(userId, x, y, nodeId, now);
        broadcast(new CollaborationEvent(CollaborationEventType.CURSOR_UPDATE, roomId, userId,
                pos.toPayload(user.userColor(), user.userName()), now));
    }

    public void selectNode(String roomId, String userId, String nodeId) {
        CollaborationRoom room = rooms.getRoom(roomId).orElse(null);
        if (room == null) return;

        Instant now = clock.instant();
        UserPresence user = room.users.computeIfPresent(userId, (id, p) ->
                p.active() ? p.withSelectedNode(nodeId, now) : p);
        if (user == null || !user.active()) return;

        broadcast(event(CollaborationEventType.NODE_SELECTED, roomId, userId, now,
                "nodeId", nodeId,
                "userColor", user.userColor(),
                "userName", user.userName()));
    }

    /**
     * node를 편집용으로 잠근다. 같은 사용자가 다시 잡거나 기존 lock이 만료됐으면 새 lock으로 덮어쓴다.
     *
     * @throws RoomNotFoundException room이 없을 때
     * @throws LockConflictException 다른 사용자의 유효한 lock이 있을 때 (holder 이름 포함)
     */
    public EditLock acquireEditLock(String roomId, String nodeId, String userId, String userName) {
        CollaborationRoom room = rooms.getRoom(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));

        room.lock.lock();
        try {
            Instant now = clock.instant();
            // lock을 기다리는 사이 마지막 사용자가 나가 room이 삭제됐을 수 있다
            if (!isRegistered(roomId, room)) throw new RoomNotFoundException(roomId);

            EditLock existing = room.editLocks.get(nodeId);
            if (existing != null && !existing.isHeldBy(userId) && !existing.isExpiredAt(now)) {
                throw new LockConflictException(nodeId, existing.userId(), existing.userName());
            }

            EditLock lock = EditLock.grant(nodeId, userId, userName, now);
            room.editLocks.put(nodeId, lock);

            room.users.computeIfPresent(userId, (id, p) -> p.withEditingNode(nodeId, now));
            if (existing != null && !existing.isHeldBy(userId)) {
                // 만료된 lock 인수: 이전 holder의 editing 표시만 정리
                room.users.computeIfPresent(existing.userId(), (id, p) ->
                        nodeId.equals(p.editingNodeId()) ? p.withEditingNode(null, p.lastActive()) : p);
            }
            log.debug("lock {} in room {} granted to {} until {}", nodeId, roomId, userId, lock.expiresAt());

            broadcast(event(CollaborationEventType.EDIT_LOCKED, roomId, userId, now,
                    "nodeId", nodeId,
                    "userName", userName,
                    "expiresAt", lock.expiresAt().toString()));
            return lock;
        } finally {
            room.lock.unlock();
        }
    }

    /**
     * @return room/lock이 없거나 userId가 holder가 아니면 false
     */
    public boolean releaseEditLock(String roomId, String nodeId, String userId) {
        CollaborationRoom room = rooms.getRoom(roomId).orElse(null);
        if (room == null) return false;

        room.lock.lock();
        try {
            if (!isRegistered(roomId, room)) return false;
            return release(room, nodeId, userId);
        } finally {
            room.lock.unlock();
        }
    }

    public PresenceSnapshot getPresenceSync(String roomId) {
        CollaborationRoom room = rooms.getRoom(roomId).orElse(null);
        if (room == null) return PresenceSnapshot.empty();

        List<PresenceSnapshot.UserEntry> users = room.getActiveUsers().stream()
                .sorted(Comparator.comparing(UserPresence::joinedAt).thenComparing(UserPresence::userId))
                .map(PresenceSnapshot.UserEntry::of)
                .toList();

        // 만료됐지만 아무도 인수하지 않은 lock도 그대로 보인다
        List<PresenceSnapshot.LockEntry> locks = room.editLocks.values().stream()
                .sorted(Comparator.comparing(EditLock::nodeId))
                .map(PresenceSnapshot.LockEntry::of)
                .toList();

        return new PresenceSnapshot(users, locks);
    }

    public void onEvent(CollaborationEventListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void offEvent(CollaborationEventListener listener) {
        listeners.remove(listener);
    }

    // ------------------- internal -------------------

    private boolean isRegistered(String roomId, CollaborationRoom room) {
        return rooms.getRoom(roomId).orElse(null) == room;
    }

    private void releaseUserLocks(CollaborationRoom room, String userId) {
        List<String> held = room.editLocks.values().stream()
                .filter(l -> l.isHeldBy(userId))
                .map(EditLock::nodeId)
                .toList();

        for (String nodeId : held) {
            release(room, nodeId, userId);
        }
    }

    private boolean release(CollaborationRoom room, String nodeId, String userId) {
        room.lock.lock();
        try {
            EditLock lock = room.editLocks.get(nodeId);
            if (lock == null || !lock.isHeldBy(userId)) return false;

            room.editLocks.remove(nodeId);

            // active 여부는 건드리지 않는다 (leave 중이면 비활성 유지)
            Instant now = clock.instant();
            room.users.computeIfPresent(userId, (id, p) ->
                    nodeId.equals(p.editingNodeId()) ? p.withEditingNode(null, now) : p);

            broadcast(event(CollaborationEventType.EDIT_UNLOCKED, room.getRoomId(), userId, now,
                    "nodeId", nodeId));
            return true;
        } finally {
            room.lock.unlock();
        }
    }

    private void broadcast(CollaborationEvent event) {
        for (CollaborationEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Exception | Error e) {
                log.warn("collaboration listener failed on {}: {}", event.type().value(), e.toString());
            }
        }
    }

    private static CollaborationEvent event(CollaborationEventType type, String roomId, String userId,
                                            Instant now, Object... kv) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            payload.put((String) kv[i], kv[i + 1]);
        }
        return new CollaborationEvent(type, roomId, userId, payload, now);
    }
}
