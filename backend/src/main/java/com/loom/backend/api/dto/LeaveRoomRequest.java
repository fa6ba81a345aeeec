package com.loom.backend.api.dto;

import jakarta.validation.constraints.NotBlank;

public record LeaveRoomRequest(
        @NotBlank String userId
) {}
