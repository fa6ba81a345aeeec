package com.loom.backend.api;

import com.loom.backend.api.dto.AppendEventRequest;
import com.loom.backend.config.LoomProperties;
import com.loom.backend.domain.AuditEntry;
import com.loom.backend.domain.Event;
import com.loom.backend.domain.EventType;
import com.loom.backend.repo.EventQuery;
import com.loom.backend.service.DomainEventRecorder;
import com.loom.backend.service.EventLogService;
import com.loom.backend.service.EventReplayService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventLogService events;
    private final EventReplayService replay;
    private final DomainEventRecorder recorder;
    private final LoomProperties props;

    public EventController(EventLogService events, EventReplayService replay,
                           DomainEventRecorder recorder, LoomProperties props) {
        this.events = events;
        this.replay = replay;
        this.recorder = recorder;
        this.props = props;
    }

    @GetMapping
    public CompletableFuture<List<Event>> list(@RequestParam(required = false) String aggregateId,
                                               @RequestParam(required = false) String aggregateType,
                                               @RequestParam(required = false) String type,
                                               @RequestParam(required = false) String since,
                                               @RequestParam(required = false) Integer limit) {
        EventQuery q = new EventQuery(
                aggregateId,
                aggregateType,
                type == null || type.isBlank() ? null : EventType.fromValue(type),
                parseSince(since),
                limit == null ? props.getEvents().getDefaultLimit() : limit
        );
        return events.getEvents(q);
    }

    @GetMapping("/recent")
    public CompletableFuture<List<Event>> recent(@RequestParam(required = false) Integer limit,
                                                 @RequestParam(required = false) String types) {
        List<EventType> kinds = types == null || types.isBlank()
                ? List.of()
                : Arrays.stream(types.split(",")).map(EventType::fromValue).toList();
        return events.getRecentActivity(limit == null ? props.getEvents().getRecentLimit() : limit, kinds);
    }

    @GetMapping("/aggregates/{aggregateType}/{aggregateId}")
    public CompletableFuture<List<Event>> history(@PathVariable String aggregateType, @PathVariable String aggregateId) {
        return events.getEventsForAggregate(aggregateId, aggregateType);
    }

    @GetMapping("/aggregates/{aggregateType}/{aggregateId}/state")
    public CompletableFuture<Map<String, Object>> state(@PathVariable String aggregateType, @PathVariable String aggregateId) {
        return replay.replayAggregate(aggregateId, aggregateType)
                .thenApply(s -> s.orElseThrow(() ->
                        new NoSuchElementException("no events for " + aggregateType + "/" + aggregateId)));
    }

    @GetMapping("/aggregates/{aggregateType}/{aggregateId}/audit")
    public CompletableFuture<List<AuditEntry>> audit(@PathVariable String aggregateType, @PathVariable String aggregateId) {
        return replay.getAuditTrail(aggregateId, aggregateType);
    }

    @PostMapping
    public CompletableFuture<ResponseEntity<Event>> append(@Valid @RequestBody AppendEventRequest req) {
        return recorder.record(
                EventType.fromValue(req.eventType),
                req.aggregateId,
                req.aggregateType,
                req.payload,
                req.userId,
                req.sessionId
        ).thenApply(e -> ResponseEntity.status(HttpStatus.CREATED).body(e));
    }

    private Instant parseSince(String since) {
        if (since == null || since.isBlank()) return null;
        try {
            return Instant.parse(since.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid since: " + since);
        }
    }
}
