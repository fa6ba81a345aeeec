package com.loom.backend.service;

import com.loom.backend.domain.UserPresence;
import com.loom.backend.repo.CollaborationRoom;

public record RoomMembership(
        CollaborationRoom room,
        UserPresence presence
) {}
