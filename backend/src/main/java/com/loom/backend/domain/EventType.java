package com.loom.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Durable event kinds. 저장되는 문자열은 value().
 */
public enum EventType {
    // graph
    NODE_CREATED("node_created"),
    NODE_UPDATED("node_updated"),
    NODE_DELETED("node_deleted"),
    EDGE_CREATED("edge_created"),
    EDGE_DELETED("edge_deleted"),

    // content
    TEXT_EDITED("text_edited"),
    PANEL_REDRAWN("panel_redrawn"),
    PANEL_GENERATED("panel_generated"),

    // branch
    BRANCH_CREATED("branch_created"),
    BRANCH_MERGED("branch_merged"),
    BRANCH_ARCHIVED("branch_archived"),

    // system
    PROJECT_SAVED("project_saved"),
    PROJECT_LOADED("project_loaded"),
    EXPORT_CREATED("export_created");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EventType fromValue(String value) {
        if (value != null) {
            String v = value.trim();
            for (EventType t : values()) {
                if (t.value.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) return t;
            }
        }
        throw new IllegalArgumentException("unknown event type: " + value);
    }
}
