package com.loom.backend;

import com.loom.backend.repo.EventStore;
import com.loom.backend.repo.InMemoryEventStore;
import com.loom.backend.service.CollaborationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class LoomBackendApplicationTests {

    @Autowired
    EventStore eventStore;

    @Autowired
    CollaborationEngine engine;

    @Test
    void contextLoadsWithConfiguredStore() {
        assertThat(eventStore).isInstanceOf(InMemoryEventStore.class);
        assertThat(engine.getRoom("never-joined")).isEmpty();
    }
}
