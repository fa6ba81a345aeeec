package com.loom.backend.repo;

import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

/**
 * 프로세스 메모리에만 두는 event log. loom.events.store=memory 또는 테스트용.
 */
public class InMemoryEventStore implements EventStore {
    private final ConcurrentLinkedDeque<Event> events = new ConcurrentLinkedDeque<>();
    private final Set<String> ids = ConcurrentHashMap.newKeySet();

    @Override
    public void append(Event event) {
        if (event == null) throw new EventStoreException("event is required");
        if (!ids.add(event.eventId())) {
            throw new EventStoreException("duplicate event id: " + event.eventId());
        }
        events.addFirst(event); // 최신이 앞
    }

    @Override
    public List<Event> getEvents(EventQuery q) {
        return newestFirst().stream()
                .filter(e -> q.aggregateId() == null || e.aggregateId().equals(q.aggregateId()))
                .filter(e -> q.aggregateType() == null || e.aggregateType().equals(q.aggregateType()))
                .filter(e -> q.eventType() == null || e.eventType() == q.eventType())
                .filter(e -> q.since() == null || e.timestamp().isAfter(q.since()))
                .limit(q.limit())
                .collect(Collectors.toList());
    }

    @Override
    public List<Event> getEventsForAggregate(String aggregateId, String aggregateType) {
        List<Event> out = new ArrayList<>(events);
        Collections.reverse(out); // append 순서
        return out.stream()
                .filter(e -> e.aggregateId().equals(aggregateId))
                .filter(e -> e.aggregateType().equals(aggregateType))
                .sorted(Comparator.comparing(Event::timestamp))
                .collect(Collectors.toList());
    }

    @Override
    public List<Event> getRecentActivity(int limit, Collection<EventType> types) {
        int lim = limit <= 0 ? DEFAULT_RECENT_LIMIT : limit;
        return newestFirst().stream()
                .filter(e -> types == null || types.isEmpty() || types.contains(e.eventType()))
                .limit(lim)
                .collect(Collectors.toList());
    }

    public int size() {
        return events.size();
    }

    // timestamp가 같으면 나중에 append된 것이 앞 (stable sort)
    private List<Event> newestFirst() {
        return events.stream()
                .sorted(Comparator.comparing(Event::timestamp).reversed())
                .collect(Collectors.toList());
    }
}
