package io.amprelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attachment(String name, String contentType, Long size, String url, String digest) {
}
