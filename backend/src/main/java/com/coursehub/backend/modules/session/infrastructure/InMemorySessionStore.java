package com.coursehub.backend.modules.session.infrastructure;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import com.coursehub.backend.modules.session.application.SessionStore;
import com.coursehub.backend.modules.session.domain.SessionRecord;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-process session store. Entries leave on logout or when an expired handle is next
 * presented; the ttl hint is not used.
 */
@Component
@ConditionalOnProperty(name = "app.session.store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionRecord> find(String handle) {
        return Optional.ofNullable(sessions.get(handle));
    }

    @Override
    public void save(String handle, SessionRecord record, Duration ttl) {
        sessions.put(handle, record);
    }

    @Override
    public Optional<SessionRecord> update(String handle, UnaryOperator<SessionRecord> change, Duration ttl) {
        return Optional.ofNullable(sessions.computeIfPresent(handle, (key, current) -> change.apply(current)));
    }

    @Override
    public Optional<SessionRecord> remove(String handle) {
        return Optional.ofNullable(sessions.remove(handle));
    }

    public int size() {
        return sessions.size();
    }
}
