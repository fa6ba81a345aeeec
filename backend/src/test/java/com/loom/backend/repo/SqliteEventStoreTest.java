package com.loom.backend.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteEventStoreTest extends AbstractEventStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper om = new ObjectMapper();

    @Override
    protected EventStore newStore() {
        return SqliteEventStore.open(dir.resolve("events.db"), om);
    }

    @Test
    void eventsSurviveReopen() {
        store.append(event("e1", EventType.NODE_CREATED, "n1", "node", 0, Map.of("label", "Intro")));
        store.append(event("e2", EventType.NODE_UPDATED, "n1", "node", 5, Map.of("changes", Map.of("label", "Intro Scene"))));

        EventStore reopened = SqliteEventStore.open(dir.resolve("events.db"), om);

        assertThat(reopened.getEventsForAggregate("n1", "node"))
                .extracting(Event::eventId).containsExactly("e1", "e2");
    }

    @Test
    void createsMissingParentDirectories() {
        Path nested = dir.resolve("a/b/c/events.db");

        SqliteEventStore.open(nested, om).append(event("e1", EventType.PROJECT_SAVED, "p1", "project", 0, null));

        assertThat(Files.exists(nested)).isTrue();
    }

    @Test
    void unusablePathFailsWithStoreError() throws Exception {
        Path blocker = Files.createFile(dir.resolve("not-a-dir"));

        assertThatThrownBy(() -> SqliteEventStore.open(blocker.resolve("events.db"), om))
                .isInstanceOf(EventStoreException.class);
    }

    @Test
    void subSecondTimestampsSortChronologically() {
        Instant base = Instant.parse("2026-03-01T09:00:00Z");
        // 문자열 길이가 달라지는 시각들: .9s, 1.000000001s
        store.append(new Event("late", EventType.NODE_UPDATED, "n1", "node", null, "u1", null, base.plusNanos(1_000_000_001)));
        store.append(new Event("early", EventType.NODE_CREATED, "n1", "node", null, "u1", null, base.plusMillis(900)));
        store.append(new Event("first", EventType.NODE_CREATED, "n0", "node", null, "u1", null, base));

        assertThat(store.getEvents(EventQuery.all())).extracting(Event::eventId)
                .containsExactly("late", "early", "first");
        assertThat(store.getEventsForAggregate("n1", "node").get(1).timestamp())
                .isEqualTo(base.plusNanos(1_000_000_001));
    }

    @Test
    void timestampFormatIsFixedWidth() {
        assertThat(SqliteEventStore.TS.format(Instant.parse("2026-03-01T09:00:00Z")))
                .isEqualTo("2026-03-01T09:00:00.000000000Z");
    }

    @Test
    void unknownStoredKindIsStoreError() {
        store.append(event("e1", EventType.NODE_CREATED, "n1", "node", 0, null));

        // 다른 버전이 남긴 행을 흉내낸다
        SQLiteDataSource ds = new SQLiteDataSource();
        ds.setUrl("jdbc:sqlite:" + dir.resolve("events.db"));
        new JdbcTemplate(ds).update(
                "INSERT INTO events (event_id, event_type, aggregate_id, aggregate_type, payload, timestamp)"
                        + " VALUES (?, ?, ?, ?, ?, ?)",
                "e2", "node_teleported", "n1", "node", "{}", "2026-03-01T09:00:01.000000000Z");

        assertThatThrownBy(() -> store.getEvents(EventQuery.all()))
                .isInstanceOf(EventStoreException.class)
                .hasMessageContaining("node_teleported");
    }
}
