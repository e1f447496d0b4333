package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire shape of every error response: {@code {error, message, field?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AmpError(ErrorKind error, String message, String field) {

    public static AmpError of(ErrorKind kind, String message) {
        return new AmpError(kind, message, null);
    }

    public static AmpError field(ErrorKind kind, String field, String message) {
        return new AmpError(kind, message, field);
    }

    public int httpStatus() {
        return error.httpStatus();
    }
}
