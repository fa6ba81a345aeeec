package com.loom.backend.domain;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public record CursorPosition(
        String userId,
        double x,
        double y,
        String nodeId,      // cursor가 올라가 있는 node (없으면 null)
        Instant timestamp
) {
    public CursorPosition {
        if (timestamp == null) timestamp = Instant.now();
    }

    public CursorPosition(String userId, double x, double y, String nodeId) {
        this(userId, x, y, nodeId, null);
    }

    /**
     * cursor_update broadcast payload. nodeId는 null일 수 있어서 HashMap을 쓴다.
     */
    public Map<String, Object> toPayload(String userColor, String userName) {
        Map<String, Object> m = new HashMap<>();
        m.put("x", x);
        m.put("y", y);
        m.put("nodeId", nodeId);
        m.put("userColor", userColor);
        m.put("userName", userName);
        return m;
    }
}
