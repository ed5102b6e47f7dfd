package com.agentbridge.model;

import java.util.Arrays;
import java.util.Optional;

public enum HookEventType {
    SESSION_IDLE("session.idle"),
    SESSION_ERROR("session.error"),
    TOOL_ACTIVITY("tool.activity"),
    SESSION_START("session.start"),
    SESSION_END("session.end"),
    SESSION_NOTIFICATION("session.notification");

    private final String wireName;

    HookEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<HookEventType> fromWire(String value) {
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(value))
            .findFirst();
    }
}
