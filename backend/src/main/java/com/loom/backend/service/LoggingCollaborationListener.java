package com.loom.backend.service;

import com.loom.backend.domain.CollaborationEvent;
import com.loom.backend.domain.CollaborationEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 협업 이벤트를 로그로 남긴다. cursor_update는 너무 잦아서 TRACE.
 */
@Component
public class LoggingCollaborationListener implements CollaborationEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingCollaborationListener.class);

    @Override
    public void onEvent(CollaborationEvent event) {
        if (event.type() == CollaborationEventType.CURSOR_UPDATE) {
            log.trace("[COLLAB] {} room={} user={}", event.type().value(), event.roomId(), event.userId());
            return;
        }
        log.info("[COLLAB] {} room={} user={} payload={}",
                event.type().value(), event.roomId(), event.userId(), event.payload());
    }
}
