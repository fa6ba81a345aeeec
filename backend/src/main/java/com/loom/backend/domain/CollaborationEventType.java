package com.loom.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CollaborationEventType {
    USER_JOINED("user_joined"),
    USER_LEFT("user_left"),
    CURSOR_UPDATE("cursor_update"),
    NODE_SELECTED("node_selected"),
    NODE_EDITING("node_editing"),
    EDIT_LOCKED("edit_locked"),
    EDIT_UNLOCKED("edit_unlocked"),
    CHANGE_APPLIED("change_applied"),
    PRESENCE_SYNC("presence_sync");

    private final String value;

    CollaborationEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
