package com.coursehub.backend.modules.session.infrastructure;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.coursehub.backend.modules.session.application.SessionStore;
import com.coursehub.backend.modules.session.application.SessionStoreUnavailableException;
import com.coursehub.backend.modules.session.domain.SessionRecord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Session store shared by every process of a deployment. Records are stored as JSON under
 * {@code <prefix><handle>} with the idle timeout as Redis TTL.
 *
 * <p>{@link #update} is read-then-write; two concurrent touches of one session can only differ
 * in {@code lastActivity}, and the later value wins.
 */
@Component
@ConditionalOnProperty(name = "app.session.store", havingValue = "redis")
public class RedisSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisSessionStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${app.session.redis.key-prefix:coursehub:session:}") String keyPrefix
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<SessionRecord> find(String handle) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key(handle));
        } catch (DataAccessException ex) {
            throw new SessionStoreUnavailableException(ex);
        }
        return deserialize(json);
    }

    @Override
    public void save(String handle, SessionRecord record, Duration ttl) {
        String json = serialize(record);
        try {
            redisTemplate.opsForValue().set(key(handle), json, ttl);
        } catch (DataAccessException ex) {
            throw new SessionStoreUnavailableException(ex);
        }
    }

    @Override
    public Optional<SessionRecord> update(String handle, UnaryOperator<SessionRecord> change, Duration ttl) {
        Optional<SessionRecord> current = find(handle);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        SessionRecord updated = change.apply(current.get());
        save(handle, updated, ttl);
        return Optional.of(updated);
    }

    @Override
    public Optional<SessionRecord> remove(String handle) {
        String json;
        try {
            json = redisTemplate.opsForValue().getAndDelete(key(handle));
        } catch (DataAccessException ex) {
            throw new SessionStoreUnavailableException(ex);
        }
        return deserialize(json);
    }

    String key(String handle) {
        return keyPrefix + handle;
    }

    private String serialize(SessionRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialise session for user " + record.userId(), ex);
        }
    }

    private Optional<SessionRecord> deserialize(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, SessionRecord.class));
        } catch (JsonProcessingException ex) {
            // unreadable entry counts as no session
            log.warn("Ignoring unreadable session entry under {}", keyPrefix, ex);
            return Optional.empty();
        }
    }
}
