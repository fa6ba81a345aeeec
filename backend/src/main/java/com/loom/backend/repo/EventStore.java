package com.loom.backend.repo;

import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;

import java.util.Collection;
import java.util.List;

/**
 * Append-only event log. 쓰기 연산은 append 하나뿐이다.
 * 모든 실패는 {@link EventStoreException}으로 올라간다.
 */
public interface EventStore {

    int DEFAULT_RECENT_LIMIT = 50;

    void append(Event event);

    /** 조건에 맞는 event, 최신순. */
    List<Event> getEvents(EventQuery query);

    /** aggregate의 전체 이력, 오래된 순 (replay용). */
    List<Event> getEventsForAggregate(String aggregateId, String aggregateType);

    /** 전체 최신 event. types가 비어 있으면 모든 종류. */
    List<Event> getRecentActivity(int limit, Collection<EventType> types);
}
