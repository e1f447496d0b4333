package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RouteStatus {
    DELIVERED,
    QUEUED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
