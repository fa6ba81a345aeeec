package com.loom.backend.service;

import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;
import com.loom.backend.repo.EventQuery;
import com.loom.backend.repo.EventStore;
import com.loom.backend.repo.EventStoreException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * EventStore 호출을 전용 executor로 넘겨서 호출 스레드를 막지 않는다.
 * 실패는 재시도 없이 future의 예외로 그대로 전달된다.
 */
@Service
public class EventLogService {
    private final EventStore store;
    private final Executor executor;

    public EventLogService(EventStore store, @Qualifier("eventLogExecutor") Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    public CompletableFuture<Event> append(Event event) {
        return offload(() -> {
            store.append(event);
            return event;
        });
    }

    public CompletableFuture<List<Event>> getEvents(EventQuery query) {
        return offload(() -> store.getEvents(query == null ? EventQuery.all() : query));
    }

    public CompletableFuture<List<Event>> getEventsForAggregate(String aggregateId, String aggregateType) {
        return offload(() -> store.getEventsForAggregate(aggregateId, aggregateType));
    }

    public CompletableFuture<List<Event>> getRecentActivity(int limit, Collection<EventType> types) {
        return offload(() -> store.getRecentActivity(limit, types));
    }

    private <T> CompletableFuture<T> offload(Supplier<T> call) {
        CompletableFuture<T> f = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    f.complete(call.get());
                } catch (Throwable e) {
                    // Error라도 future는 반드시 끝낸다 (안 그러면 async 요청이 멈춘다)
                    f.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            f.completeExceptionally(new EventStoreException("event log executor is saturated", e));
        }
        return f;
    }
}
