package com.loom.backend.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SelectNodeRequest(
        @NotBlank String userId,
        String nodeId   // null이면 선택 해제
) {}
