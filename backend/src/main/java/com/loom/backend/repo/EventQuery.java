package com.loom.backend.repo;

import com.loom.backend.domain.EventType;

import java.time.Instant;

/**
 * getEvents 필터. null 필드는 조건에서 빠지고, 나머지는 AND로 묶인다.
 */
public record EventQuery(
        String aggregateId,
        String aggregateType,
        EventType eventType,
        Instant since,      // timestamp > since
        int limit
) {
    public static final int DEFAULT_LIMIT = 100;

    public EventQuery {
        if (aggregateId != null && aggregateId.isBlank()) aggregateId = null;
        if (aggregateType != null && aggregateType.isBlank()) aggregateType = null;
        if (limit <= 0) limit = DEFAULT_LIMIT;
    }

    public static EventQuery all() {
        return new EventQuery(null, null, null, null, DEFAULT_LIMIT);
    }

    public EventQuery withLimit(int limit) {
        return new EventQuery(aggregateId, aggregateType, eventType, since, limit);
    }
}
