package io.amprelay.federation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FederationReceipt(
        int httpStatus,
        String id,
        String status,
        String method,
        @JsonProperty("delivered_at") String deliveredAt,
        String error,
        String message
) {
    public boolean accepted() {
        return httpStatus >= 200 && httpStatus < 300;
    }
}
