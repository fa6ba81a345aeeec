package com.loom.backend.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * SQLite 파일 하나에 event를 쌓는 저장소.
 * timestamp는 고정 길이 ISO-8601(UTC, 나노초 9자리) 문자열로 저장해서
 * 문자열 정렬 = 시간 정렬이 되도록 한다. 같은 시각은 rowid(append 순서)로 정렬.
 */
public class SqliteEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteEventStore.class);

    static final DateTimeFormatter TS = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 9, 9, true)
            .appendLiteral('Z')
            .toFormatter()
            .withZone(ZoneOffset.UTC);

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
            "event_id, event_type, aggregate_id, aggregate_type, payload, user_id, session_id, timestamp";

    private final JdbcTemplate jdbc;
    private final ObjectMapper om;

    public SqliteEventStore(JdbcTemplate jdbc, ObjectMapper om) {
        this.jdbc = jdbc;
        this.om = om;
        ensureSchema();
    }

    /**
     * 파일 경로로 저장소를 연다. 상위 디렉터리가 없으면 만든다.
     */
    public static SqliteEventStore open(Path dbPath, ObjectMapper om) {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new EventStoreException("cannot create event store directory for " + dbPath, e);
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(5000);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);

        SQLiteDataSource ds = new SQLiteDataSource(config);
        ds.setUrl("jdbc:sqlite:" + dbPath);
        return new SqliteEventStore(new JdbcTemplate(ds), om);
    }

    private void ensureSchema() {
        guard("schema init", () -> {
            jdbc.execute("""
                    CREATE TABLE IF NOT EXISTS events (
                        event_id TEXT PRIMARY KEY,
                        event_type TEXT NOT NULL,
                        aggregate_id TEXT NOT NULL,
                        aggregate_type TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        user_id TEXT,
                        session_id TEXT,
                        timestamp TEXT NOT NULL
                    )
                    """);
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_events_aggregate ON events(aggregate_id, aggregate_type)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_events_type ON events(event_type)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_events_timestamp ON events(timestamp)");
            return null;
        });
        log.info("event store schema ready");
    }

    @Override
    public void append(Event event) {
        if (event == null) throw new EventStoreException("event is required");
        String payload = writePayload(event.payload());
        guard("append " + event.eventId(), () -> jdbc.update(
                "INSERT INTO events (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                event.eventId(),
                event.eventType().value(),
                event.aggregateId(),
                event.aggregateType(),
                payload,
                event.userId(),
                event.sessionId(),
                TS.format(event.timestamp())
        ));
    }

    @Override
    public List<Event> getEvents(EventQuery q) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM events WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (q.aggregateId() != null) {
            sql.append(" AND aggregate_id = ?");
            params.add(q.aggregateId());
        }
        if (q.aggregateType() != null) {
            sql.append(" AND aggregate_type = ?");
            params.add(q.aggregateType());
        }
        if (q.eventType() != null) {
            sql.append(" AND event_type = ?");
            params.add(q.eventType().value());
        }
        if (q.since() != null) {
            sql.append(" AND timestamp > ?");
            params.add(TS.format(q.since()));
        }
        sql.append(" ORDER BY timestamp DESC, rowid DESC LIMIT ?");
        params.add(q.limit());

        return guard("query", () -> jdbc.query(sql.toString(), rowMapper(), params.toArray()));
    }

    @Override
    public List<Event> getEventsForAggregate(String aggregateId, String aggregateType) {
        return guard("aggregate history", () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM events WHERE aggregate_id = ? AND aggregate_type = ?"
                        + " ORDER BY timestamp ASC, rowid ASC",
                rowMapper(), aggregateId, aggregateType));
    }

    @Override
    public List<Event> getRecentActivity(int limit, Collection<EventType> types) {
        int lim = limit <= 0 ? DEFAULT_RECENT_LIMIT : limit;
        if (types == null || types.isEmpty()) {
            return guard("recent activity", () -> jdbc.query(
                    "SELECT " + COLUMNS + " FROM events ORDER BY timestamp DESC, rowid DESC LIMIT ?",
                    rowMapper(), lim));
        }

        List<Object> params = new ArrayList<>();
        types.forEach(t -> params.add(t.value()));
        params.add(lim);
        String placeholders = String.join(",", Collections.nCopies(types.size(), "?"));

        return guard("recent activity", () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM events WHERE event_type IN (" + placeholders + ")"
                        + " ORDER BY timestamp DESC, rowid DESC LIMIT ?",
                rowMapper(), params.toArray()));
    }

    // ------------------- helpers -------------------

    private RowMapper<Event> rowMapper() {
        return (rs, i) -> new Event(
                rs.getString("event_id"),
                readType(rs.getString("event_type")),
                rs.getString("aggregate_id"),
                rs.getString("aggregate_type"),
                readPayload(rs.getString("payload")),
                rs.getString("user_id"),
                rs.getString("session_id"),
                Instant.parse(rs.getString("timestamp"))
        );
    }

    private EventType readType(String raw) {
        try {
            return EventType.fromValue(raw);
        } catch (IllegalArgumentException e) {
            // 다른 버전이 쓴 행일 수 있음. 요청 오류가 아니라 저장소 오류로 본다
            throw new EventStoreException("unknown event type in event store: " + raw, e);
        }
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return om.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("payload is not serializable", e);
        }
    }

    private Map<String, Object> readPayload(String raw) {
        if (raw == null || raw.isBlank()) return Map.of();
        try {
            return om.readValue(raw, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("corrupt payload in event store", e);
        }
    }

    private <T> T guard(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("event store {} failed: {}", what, e.getMessage());
            throw new EventStoreException("event store " + what + " failed", e);
        }
    }
}
