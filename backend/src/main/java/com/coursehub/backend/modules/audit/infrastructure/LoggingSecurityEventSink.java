package com.coursehub.backend.modules.audit.infrastructure;

import com.coursehub.backend.modules.audit.application.SecurityEventSink;
import com.coursehub.backend.modules.audit.domain.SecurityEvent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes each event as one JSON line to the {@code security.events} logger category.
 */
@Component
public class LoggingSecurityEventSink implements SecurityEventSink {

    static final String CATEGORY = "security.events";

    private static final Logger log = LoggerFactory.getLogger(CATEGORY);

    private final ObjectMapper objectMapper;

    public LoggingSecurityEventSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void emit(SecurityEvent event) {
        try {
            log.info("SECURITY EVENT: {}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialise security event " + event.eventType(), ex);
        }
    }
}
