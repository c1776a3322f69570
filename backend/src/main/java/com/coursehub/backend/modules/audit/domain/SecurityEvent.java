package com.coursehub.backend.modules.audit.domain;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityEvent(
        OffsetDateTime timestamp,
        @JsonProperty("event_type") String eventType,
        String details,
        @JsonProperty("user_id") Long userId,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("user_agent") String userAgent
) {
}
