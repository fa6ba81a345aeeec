package com.loom.backend.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * room 구성원에게 broadcast되는 일회성 알림. 저장하지 않는다.
 */
public record CollaborationEvent(
        CollaborationEventType type,
        String roomId,
        String userId,
        Map<String, Object> payload,
        Instant timestamp
) {
    public CollaborationEvent {
        // payload 값에 null이 들어갈 수 있어 Map.copyOf 대신 unmodifiable view
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (timestamp == null) timestamp = Instant.now();
    }

    public Map<String, Object> toEnvelope() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type.value());
        m.put("roomId", roomId);
        m.put("userId", userId);
        m.put("payload", payload);
        m.put("timestamp", timestamp.toString());
        return m;
    }
}
