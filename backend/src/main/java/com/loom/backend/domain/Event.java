package com.loom.backend.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Event log에 append되는 불변 레코드. 한 번 저장되면 수정/삭제하지 않는다.
 */
public record Event(
        String eventId,
        EventType eventType,
        String aggregateId,     // node id, branch id, scene id ...
        String aggregateType,   // "node" | "branch" | "scene" | "project"
        Map<String, Object> payload,
        String userId,
        String sessionId,
        Instant timestamp
) {
    public Event {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (timestamp == null) timestamp = Instant.now();
    }
}
