package com.loom.backend.service;

import com.loom.backend.domain.AuditEntry;
import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;
import com.loom.backend.repo.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventReplayServiceTest {

    private static final Instant T0 = Instant.parse("2026-02-10T12:00:00Z");

    private InMemoryEventStore store;
    private EventReplayService replay;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        replay = new EventReplayService(new EventLogService(store, Runnable::run));
    }

    private void append(String id, EventType type, String aggregateId, String aggregateType,
                        Map<String, Object> payload, String userId, long seconds) {
        store.append(new Event(id, type, aggregateId, aggregateType, payload, userId, null, T0.plusSeconds(seconds)));
    }

    @Test
    void replaysCreateThenUpdate() {
        append("e1", EventType.NODE_CREATED, "n1", "node",
                Map.of("label", "Intro", "x", 10.0, "y", 20.0, "branch_id", "b1"), "u1", 0);
        append("e2", EventType.NODE_UPDATED, "n1", "node",
                Map.of("changes", Map.of("label", "Intro Scene")), "u1", 30);

        Map<String, Object> state = replay.replayAggregate("n1", "node").join().orElseThrow();

        assertThat(state)
                .containsEntry("aggregate_id", "n1")
                .containsEntry("aggregate_type", "node")
                .containsEntry("label", "Intro Scene")
                .containsEntry("x", 10.0)
                .containsEntry("y", 20.0)
                .containsEntry("branch_id", "b1")
                .containsEntry("event_count", 2)
                .containsEntry("created_at", T0.toString())
                .containsEntry("updated_at", T0.plusSeconds(30).toString());
    }

    @Test
    void replayIsDeterministic() {
        append("e1", EventType.NODE_CREATED, "n1", "node", Map.of("label", "A"), "u1", 0);
        append("e2", EventType.NODE_DELETED, "n1", "node", Map.of(), "u1", 10);

        Map<String, Object> first = replay.replayAggregate("n1", "node").join().orElseThrow();
        Map<String, Object> second = replay.replayAggregate("n1", "node").join().orElseThrow();

        assertThat(first).isEqualTo(second);
        assertThat(first).containsEntry("deleted", true).containsEntry("deleted_at", T0.plusSeconds(10).toString());
    }

    @Test
    void unknownAggregateReplaysToEmpty() {
        assertThat(replay.replayAggregate("missing", "node").join()).isEmpty();
        assertThat(replay.getAuditTrail("missing", "node").join()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void panelsAccumulateAndTextEditsKeepLatest() {
        append("e1", EventType.PANEL_GENERATED, "sc1", "scene",
                Map.of("panel_index", 0, "image_id", "img-a", "model_id", "sdxl"), "u1", 0);
        append("e2", EventType.TEXT_EDITED, "sc1", "scene",
                Map.of("span", Map.of("start", 0, "end", 4), "edit_summary", "first pass"), "u1", 5);
        append("e3", EventType.PANEL_GENERATED, "sc1", "scene",
                Map.of("panel_index", 1, "image_id", "img-b", "model_id", "flux"), "u2", 10);
        append("e4", EventType.TEXT_EDITED, "sc1", "scene",
                Map.of("span", Map.of("start", 5, "end", 9), "edit_summary", "tightened"), "u2", 15);

        Map<String, Object> state = replay.replayAggregate("sc1", "scene").join().orElseThrow();

        List<Map<String, Object>> panels = (List<Map<String, Object>>) state.get("panels");
        assertThat(panels).extracting(p -> p.get("image_id")).containsExactly("img-a", "img-b");
        assertThat(panels.get(1)).containsEntry("panel_index", 1)
                .containsEntry("model_id", "flux")
                .containsEntry("generated_at", T0.plusSeconds(10).toString());

        Map<String, Object> lastEdit = (Map<String, Object>) state.get("last_edit");
        assertThat(lastEdit).containsEntry("user", "u2")
                .containsEntry("summary", "tightened")
                .containsEntry("timestamp", T0.plusSeconds(15).toString());
        assertThat(lastEdit.get("span")).isEqualTo(Map.of("start", 5, "end", 9));
    }

    @Test
    void branchCreationAndUnhandledKindsFold() {
        append("e1", EventType.BRANCH_CREATED, "b2", "branch",
                Map.of("label", "What if", "parent_branch_id", "b1", "source_node_id", "n3"), "u1", 0);
        append("e2", EventType.BRANCH_MERGED, "b2", "branch", Map.of("into", "b1"), "u1", 5);

        Map<String, Object> state = replay.replayAggregate("b2", "branch").join().orElseThrow();

        assertThat(state).containsEntry("label", "What if")
                .containsEntry("parent_branch_id", "b1")
                .containsEntry("source_node_id", "n3")
                .containsEntry("event_count", 2)
                .doesNotContainKey("into");
    }

    @Test
    void auditTrailDescribesEachEvent() {
        append("e1", EventType.NODE_CREATED, "n1", "node", Map.of("label", "Intro"), "u1", 0);
        append("e2", EventType.NODE_UPDATED, "n1", "node",
                Map.of("changes", Map.of("label", "Intro Scene")), "u1", 30);
        append("e3", EventType.NODE_DELETED, "n1", "node", Map.of(), null, 60);

        List<AuditEntry> trail = replay.getAuditTrail("n1", "node").join();

        assertThat(trail).extracting(AuditEntry::details)
                .containsExactly("Created node 'Intro'", "Updated: label", "Deleted node");
        assertThat(trail).extracting(AuditEntry::action)
                .containsExactly("node_created", "node_updated", "node_deleted");
        assertThat(trail).extracting(AuditEntry::user).containsExactly("u1", "u1", "system");
        assertThat(trail.get(1).timestamp()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    void auditFallbacksForMissingFields() {
        assertThat(details(EventType.NODE_CREATED, Map.of())).isEqualTo("Created node 'unnamed'");
        assertThat(details(EventType.TEXT_EDITED, Map.of())).isEqualTo("Edited text: changes made");
        assertThat(details(EventType.PANEL_GENERATED, Map.of())).isEqualTo("Generated panel with model unknown");
        assertThat(details(EventType.BRANCH_CREATED, Map.of("label", "Alt"))).isEqualTo("Created branch 'Alt'");
        assertThat(details(EventType.NODE_UPDATED, Map.of("changes", List.of("x", "y")))).isEqualTo("Updated: x, y");
        assertThat(details(EventType.PROJECT_SAVED, Map.of("path", "a.loom"))).isEqualTo("{path=a.loom}");
    }

    @Test
    void staticReplayOfEmptyListIsEmpty() {
        assertThat(EventReplayService.replay("n1", "node", List.of())).isEqualTo(Optional.empty());
    }

    private static String details(EventType type, Map<String, Object> payload) {
        Event e = new Event("e", type, "a", "node", payload, "u1", null, T0);
        return EventReplayService.toAuditEntry(e).details();
    }
}
