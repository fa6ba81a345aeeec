package com.loom.backend.domain;

import java.time.Instant;

public record AuditEntry(
        Instant timestamp,
        String action,   // event type value
        String user,     // userId, 없으면 "system"
        String details
) {}
