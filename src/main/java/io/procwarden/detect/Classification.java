package io.procwarden.detect;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Classification {
    CONFIRMED("confirmed"),
    SUSPECTED("suspected");

    private final String wireName;

    Classification(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
