package com.coursehub.backend.modules.session.application;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.coursehub.backend.modules.session.domain.SessionRecord;

/**
 * Storage for session state keyed by opaque handle. Every operation is idempotent and safe to
 * retry. Implementations backed by a remote store report outages with
 * {@link SessionStoreUnavailableException}, never by pretending a session is absent.
 */
public interface SessionStore {

    Optional<SessionRecord> find(String handle);

    /**
     * @param ttl how long the store may keep the entry without activity; expiry checks in
     *            {@link SessionService} remain authoritative
     */
    void save(String handle, SessionRecord record, Duration ttl);

    /**
     * Applies {@code change} to the stored record if one exists and returns the result.
     */
    Optional<SessionRecord> update(String handle, UnaryOperator<SessionRecord> change, Duration ttl);

    /**
     * Removes the entry and returns what was stored, if anything.
     */
    Optional<SessionRecord> remove(String handle);
}
