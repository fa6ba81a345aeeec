package com.loom.backend.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public class AppendEventRequest {
    @NotBlank
    public String eventType;

    @NotBlank
    public String aggregateId;

    @NotBlank
    public String aggregateType;

    public Map<String, Object> payload;
    public String userId;
    public String sessionId;
}
