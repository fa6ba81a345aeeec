package com.loom.backend.service;

import com.loom.backend.domain.AuditEntry;
import com.loom.backend.domain.Event;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * aggregate 이력을 접어서 현재 상태를 복원하고, 사람이 읽는 audit trail로 바꾼다.
 *
 * <p>event 종류별 처리는 모두 enum 전체를 다루는 switch 식이라서
 * 새 종류를 추가하면 두 곳 모두 컴파일 단계에서 결정을 강제받는다.
 */
@Service
public class EventReplayService {
    private final EventLogService eventLog;

    public EventReplayService(EventLogService eventLog) {
        this.eventLog = eventLog;
    }

    public CompletableFuture<Optional<Map<String, Object>>> replayAggregate(String aggregateId, String aggregateType) {
        return eventLog.getEventsForAggregate(aggregateId, aggregateType)
                .thenApply(events -> replay(aggregateId, aggregateType, events));
    }

    public CompletableFuture<List<AuditEntry>> getAuditTrail(String aggregateId, String aggregateType) {
        return eventLog.getEventsForAggregate(aggregateId, aggregateType)
                .thenApply(events -> events.stream()
                        .map(EventReplayService::toAuditEntry)
                        .collect(Collectors.toList()));
    }

    /**
     * 오래된 순으로 정렬된 event 목록만으로 상태를 만든다. 호출 시각 등 외부 값은 쓰지 않는다.
     */
    static Optional<Map<String, Object>> replay(String aggregateId, String aggregateType, List<Event> events) {
        if (events == null || events.isEmpty()) return Optional.empty();

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("aggregate_id", aggregateId);
        state.put("aggregate_type", aggregateType);
        state.put("created_at", events.get(0).timestamp().toString());
        state.put("updated_at", events.get(events.size() - 1).timestamp().toString());
        state.put("event_count", events.size());

        for (Event e : events) {
            state = apply(state, e);
        }
        return Optional.of(Collections.unmodifiableMap(state));
    }

    static AuditEntry toAuditEntry(Event e) {
        return new AuditEntry(
                e.timestamp(),
                e.eventType().value(),
                e.userId() == null ? "system" : e.userId(),
                formatDetails(e)
        );
    }

    // ------------------- fold -------------------

    private static Map<String, Object> apply(Map<String, Object> state, Event e) {
        return switch (e.eventType()) {
            case NODE_CREATED -> onNodeCreated(state, e);
            case NODE_UPDATED -> onNodeUpdated(state, e);
            case NODE_DELETED -> onNodeDeleted(state, e);
            case TEXT_EDITED -> onTextEdited(state, e);
            case PANEL_GENERATED -> onPanelGenerated(state, e);
            case BRANCH_CREATED -> onBranchCreated(state, e);
            case EDGE_CREATED, EDGE_DELETED, PANEL_REDRAWN,
                 BRANCH_MERGED, BRANCH_ARCHIVED,
                 PROJECT_SAVED, PROJECT_LOADED, EXPORT_CREATED -> state;
        };
    }

    private static Map<String, Object> onNodeCreated(Map<String, Object> state, Event e) {
        Map<String, Object> p = e.payload();
        state.put("label", p.get("label"));
        state.put("x", p.get("x"));
        state.put("y", p.get("y"));
        state.put("branch_id", p.get("branch_id"));
        return state;
    }

    private static Map<String, Object> onNodeUpdated(Map<String, Object> state, Event e) {
        if (e.payload().get("changes") instanceof Map<?, ?> changes) {
            changes.forEach((k, v) -> state.put(String.valueOf(k), v));
        }
        return state;
    }

    private static Map<String, Object> onNodeDeleted(Map<String, Object> state, Event e) {
        state.put("deleted", true);
        state.put("deleted_at", e.timestamp().toString());
        return state;
    }

    private static Map<String, Object> onTextEdited(Map<String, Object> state, Event e) {
        Map<String, Object> edit = new LinkedHashMap<>();
        edit.put("timestamp", e.timestamp().toString());
        edit.put("user", e.userId());
        edit.put("span", e.payload().get("span"));
        edit.put("summary", e.payload().get("edit_summary"));
        state.put("last_edit", edit);
        return state;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> onPanelGenerated(Map<String, Object> state, Event e) {
        List<Object> panels = (List<Object>) state.computeIfAbsent("panels", k -> new ArrayList<>());
        Map<String, Object> panel = new LinkedHashMap<>();
        panel.put("panel_index", e.payload().get("panel_index"));
        panel.put("image_id", e.payload().get("image_id"));
        panel.put("model_id", e.payload().get("model_id"));
        panel.put("generated_at", e.timestamp().toString());
        panels.add(panel);
        return state;
    }

    private static Map<String, Object> onBranchCreated(Map<String, Object> state, Event e) {
        Map<String, Object> p = e.payload();
        state.put("label", p.get("label"));
        state.put("parent_branch_id", p.get("parent_branch_id"));
        state.put("source_node_id", p.get("source_node_id"));
        return state;
    }

    // ------------------- audit -------------------

    private static String formatDetails(Event e) {
        Map<String, Object> p = e.payload();
        return switch (e.eventType()) {
            case NODE_CREATED -> "Created node '" + text(p.get("label"), "unnamed") + "'";
            case NODE_UPDATED -> "Updated: " + changedKeys(p.get("changes"));
            case NODE_DELETED -> "Deleted node";
            case TEXT_EDITED -> "Edited text: " + text(p.get("edit_summary"), "changes made");
            case PANEL_GENERATED -> "Generated panel with model " + text(p.get("model_id"), "unknown");
            case BRANCH_CREATED -> "Created branch '" + text(p.get("label"), "unnamed") + "'";
            case EDGE_CREATED, EDGE_DELETED, PANEL_REDRAWN,
                 BRANCH_MERGED, BRANCH_ARCHIVED,
                 PROJECT_SAVED, PROJECT_LOADED, EXPORT_CREATED -> String.valueOf(p);
        };
    }

    private static String changedKeys(Object changes) {
        if (changes instanceof Map<?, ?> m) {
            return m.keySet().stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        if (changes instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return "";
    }

    private static String text(Object v, String fallback) {
        return v == null ? fallback : String.valueOf(v);
    }
}
