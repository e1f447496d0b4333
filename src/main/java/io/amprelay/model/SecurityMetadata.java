package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityMetadata(
        TrustLevel trust,
        @JsonProperty("wrapped_by") String wrappedBy,
        @JsonProperty("injection_flags") List<String> injectionFlags
) {
    public SecurityMetadata {
        injectionFlags = injectionFlags == null ? List.of() : List.copyOf(injectionFlags);
    }
}
