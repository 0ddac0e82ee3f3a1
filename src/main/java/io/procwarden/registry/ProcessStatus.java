package io.procwarden.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessStatus {
    RUNNING("running"),
    ORPHANED("orphaned"),
    TERMINATED("terminated");

    private final String wireName;

    ProcessStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ProcessStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return RUNNING;
        }
        for (ProcessStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown process status: " + raw);
    }
}
