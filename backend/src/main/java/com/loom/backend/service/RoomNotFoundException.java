package com.loom.backend.service;

import java.util.NoSuchElementException;

public class RoomNotFoundException extends NoSuchElementException {
    private final String roomId;

    public RoomNotFoundException(String roomId) {
        super("Room not found: " + roomId);
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
