package com.coursehub.backend.modules.audit.application;

import com.coursehub.backend.modules.audit.domain.SecurityEvent;

/**
 * Destination for security events (log shipper, SIEM forwarder, ...).
 */
public interface SecurityEventSink {

    void emit(SecurityEvent event);
}
