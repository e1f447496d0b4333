package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrustLevel {
    LOCAL("local"),
    EXTERNAL("external"),
    UNTRUSTED("untrusted");

    private final String wireName;

    TrustLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
