package com.loom.backend.service;

import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 도메인 변경이 일어난 시점에 event를 만들어 log에 append하는 helper.
 * payload 모양은 EventReplayService의 fold/audit이 그대로 읽는다.
 */
@Service
public class DomainEventRecorder {
    private final EventLogService eventLog;
    private final EventIdGenerator ids;
    private final Clock clock;

    public DomainEventRecorder(EventLogService eventLog, EventIdGenerator ids, Clock clock) {
        this.eventLog = eventLog;
        this.ids = ids;
        this.clock = clock;
    }

    public CompletableFuture<Event> logNodeCreated(String nodeId, String label, double x, double y,
                                                   String branchId, String userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("label", label);
        payload.put("x", x);
        payload.put("y", y);
        payload.put("branch_id", branchId);
        return record(EventType.NODE_CREATED, nodeId, "node", payload, userId, null);
    }

    public CompletableFuture<Event> logNodeUpdated(String nodeId, Map<String, Object> changes, String userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("changes", changes == null ? Map.of() : changes);
        return record(EventType.NODE_UPDATED, nodeId, "node", payload, userId, null);
    }

    public CompletableFuture<Event> logTextEdited(String sceneId, Map<String, Object> span,
                                                  String editSummary, String userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("span", span);
        payload.put("edit_summary", editSummary);
        return record(EventType.TEXT_EDITED, sceneId, "scene", payload, userId, null);
    }

    public CompletableFuture<Event> logPanelGenerated(String sceneId, int panelIndex, String imageId,
                                                      String modelId, String userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("panel_index", panelIndex);
        payload.put("image_id", imageId);
        payload.put("model_id", modelId);
        // id seed는 image id (같은 scene에 panel이 연달아 생겨도 겹치지 않게)
        Event event = new Event(ids.nextId(imageId), EventType.PANEL_GENERATED, sceneId, "scene",
                payload, userId, null, clock.instant());
        return eventLog.append(event);
    }

    public CompletableFuture<Event> logBranchCreated(String branchId, String label, String parentBranchId,
                                                     String sourceNodeId, String userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("label", label);
        payload.put("parent_branch_id", parentBranchId);
        payload.put("source_node_id", sourceNodeId);
        return record(EventType.BRANCH_CREATED, branchId, "branch", payload, userId, null);
    }

    public CompletableFuture<Event> record(EventType type, String aggregateId, String aggregateType,
                                           Map<String, Object> payload, String userId, String sessionId) {
        if (type == null) throw new IllegalArgumentException("eventType is required");
        if (aggregateId == null || aggregateId.isBlank()) throw new IllegalArgumentException("aggregateId is required");
        if (aggregateType == null || aggregateType.isBlank()) throw new IllegalArgumentException("aggregateType is required");

        Event event = new Event(ids.nextId(aggregateId), type, aggregateId, aggregateType,
                payload, userId, sessionId, clock.instant());
        return eventLog.append(event);
    }
}
