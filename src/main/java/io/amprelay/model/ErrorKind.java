package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {
    MISSING_HEADER("missing_header", 400),
    INVALID_REQUEST("invalid_request", 400),
    MISSING_FIELD("missing_field", 400),
    INVALID_FIELD("invalid_field", 400),
    UNAUTHORIZED("unauthorized", 401),
    FORBIDDEN("forbidden", 403),
    NOT_FOUND("not_found", 404),
    DUPLICATE_MESSAGE("duplicate_message", 409),
    RATE_LIMITED("rate_limited", 429),
    INTERNAL_ERROR("internal_error", 500);

    private final String code;
    private final int httpStatus;

    ErrorKind(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
