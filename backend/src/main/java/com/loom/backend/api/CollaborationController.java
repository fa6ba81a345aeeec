package com.loom.backend.api;

import com.loom.backend.api.dto.CursorUpdateRequest;
import com.loom.backend.api.dto.JoinRoomRequest;
import com.loom.backend.api.dto.LeaveRoomRequest;
import com.loom.backend.api.dto.LockRequest;
import com.loom.backend.api.dto.SelectNodeRequest;
import com.loom.backend.domain.EditLock;
import com.loom.backend.domain.PresenceSnapshot;
import com.loom.backend.repo.CollaborationRoom;
import com.loom.backend.service.CollaborationEngine;
import com.loom.backend.service.RoomMembership;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 협업 engine을 HTTP로 노출한다. 사용자 식별자는 호출자가 준 값을 그대로 믿는다.
 */
@RestController
@RequestMapping("/api/v1/collab/rooms/{roomId}")
public class CollaborationController {

    private final CollaborationEngine engine;

    public CollaborationController(CollaborationEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/join")
    public Map<String, Object> join(@PathVariable String roomId, @Valid @RequestBody JoinRoomRequest body) {
        RoomMembership m = engine.joinRoom(roomId, body.userId(), body.userName());
        return Map.of(
                "room", roomSummary(m.room()),
                "presence", m.presence()
        );
    }

    @PostMapping("/leave")
    public Map<String, Object> leave(@PathVariable String roomId, @Valid @RequestBody LeaveRoomRequest body) {
        Optional<CollaborationRoom> room = engine.leaveRoom(roomId, body.userId());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("roomId", roomId);
        out.put("closed", room.isEmpty());
        room.ifPresent(r -> out.put("userCount", r.getUserCount()));
        return out;
    }

    @PostMapping("/cursor")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void cursor(@PathVariable String roomId, @Valid @RequestBody CursorUpdateRequest body) {
        engine.updateCursor(roomId, body.userId(), body.x(), body.y(), body.nodeId());
    }

    @PostMapping("/select")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void select(@PathVariable String roomId, @Valid @RequestBody SelectNodeRequest body) {
        engine.selectNode(roomId, body.userId(), body.nodeId());
    }

    @PostMapping("/locks/{nodeId}")
    public EditLock lock(@PathVariable String roomId, @PathVariable String nodeId,
                         @Valid @RequestBody LockRequest body) {
        return engine.acquireEditLock(roomId, nodeId, body.userId(), body.userName());
    }

    @DeleteMapping("/locks/{nodeId}")
    public ResponseEntity<Map<String, Object>> unlock(@PathVariable String roomId, @PathVariable String nodeId,
                                                      @RequestParam String userId) {
        boolean ok = engine.releaseEditLock(roomId, nodeId, userId);
        // lock이 없거나 holder가 아님
        if (!ok) return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("ok", false));
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @GetMapping("/presence")
    public PresenceSnapshot presence(@PathVariable String roomId) {
        return engine.getPresenceSync(roomId);
    }

    private Map<String, Object> roomSummary(CollaborationRoom room) {
        return Map.of(
                "roomId", room.getRoomId(),
                "createdAt", room.getCreatedAt(),
                "userCount", room.getUserCount()
        );
    }
}
