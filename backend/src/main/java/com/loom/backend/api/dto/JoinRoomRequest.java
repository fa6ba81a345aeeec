package com.loom.backend.api.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinRoomRequest(
        @NotBlank String userId,
        @NotBlank String userName
) {}
