package com.loom.backend.api.dto;

import jakarta.validation.constraints.NotBlank;

public record LockRequest(
        @NotBlank String userId,
        @NotBlank String userName
) {}
