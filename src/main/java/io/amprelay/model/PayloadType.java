package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PayloadType {
    REQUEST("request"),
    RESPONSE("response"),
    NOTIFICATION("notification"),
    UPDATE("update"),
    SYSTEM("system");

    private final String wireName;

    PayloadType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static PayloadType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Payload type must not be blank");
        }
        for (PayloadType value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown payload type: " + raw);
    }
}
