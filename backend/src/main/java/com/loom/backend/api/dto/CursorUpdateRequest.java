package com.loom.backend.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CursorUpdateRequest(
        @NotBlank String userId,
        double x,
        double y,
        String nodeId   // cursor 아래 node, 선택
) {}
