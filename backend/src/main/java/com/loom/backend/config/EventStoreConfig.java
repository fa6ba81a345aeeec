package com.loom.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loom.backend.repo.EventStore;
import com.loom.backend.repo.InMemoryEventStore;
import com.loom.backend.repo.SqliteEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class EventStoreConfig {
    private static final Logger log = LoggerFactory.getLogger(EventStoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventStore eventStore(LoomProperties props, ObjectMapper om) {
        LoomProperties.Events cfg = props.getEvents();
        String kind = cfg.getStore() == null ? "sqlite" : cfg.getStore().trim().toLowerCase();
        return switch (kind) {
            case "memory" -> {
                log.info("event store: in-memory (events are lost on restart)");
                yield new InMemoryEventStore();
            }
            case "sqlite" -> {
                log.info("event store: sqlite at {}", cfg.getDbPath());
                yield SqliteEventStore.open(Path.of(cfg.getDbPath()), om);
            }
            default -> throw new IllegalArgumentException("loom.events.store must be sqlite or memory: " + kind);
        };
    }

    @Bean(name = "eventLogExecutor")
    public ThreadPoolTaskExecutor eventLogExecutor(LoomProperties props) {
        LoomProperties.Executor cfg = props.getEvents().getExecutor();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(cfg.getCoreSize());
        ex.setMaxPoolSize(cfg.getMaxSize());
        ex.setQueueCapacity(cfg.getQueueCapacity());
        ex.setThreadNamePrefix("event-log-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
