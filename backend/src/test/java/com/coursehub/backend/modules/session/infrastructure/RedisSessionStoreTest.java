package com.coursehub.backend.modules.session.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import com.coursehub.backend.modules.session.application.SessionStoreUnavailableException;
import com.coursehub.backend.modules.session.domain.SessionRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class RedisSessionStoreTest {

    private static final Duration TTL = Duration.ofHours(24);
    private static final SessionRecord RECORD = new SessionRecord(
            7L,
            Instant.parse("2024-03-01T10:00:00Z"),
            Instant.parse("2024-03-01T10:30:00Z"),
            "server-token",
            false
    );

    private ValueOperations<String, String> valueOperations;
    private RedisSessionStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        store = new RedisSessionStore(redisTemplate, objectMapper, "test:session:");
    }

    @Test
    void saveWritesJsonWithIdleTimeoutTtl() {
        store.save("handle-1", RECORD, TTL);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("test:session:handle-1"), json.capture(), eq(TTL));
        assertThat(json.getValue()).contains("\"userId\":7").doesNotContain("handle-1");
    }

    @Test
    void savedRecordReadsBack() {
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        store.save("handle-1", RECORD, TTL);
        verify(valueOperations).set(anyString(), json.capture(), eq(TTL));
        when(valueOperations.get("test:session:handle-1")).thenReturn(json.getValue());

        assertThat(store.find("handle-1")).contains(RECORD);
    }

    @Test
    void missingOrUnreadableEntryIsNoSession() {
        when(valueOperations.get("test:session:gone")).thenReturn(null);
        when(valueOperations.get("test:session:garbled")).thenReturn("{not json");

        assertThat(store.find("gone")).isEmpty();
        assertThat(store.find("garbled")).isEmpty();
    }

    @Test
    void updateOfMissingSessionWritesNothing() {
        when(valueOperations.get("test:session:gone")).thenReturn(null);

        assertThat(store.update("gone", record -> record.touchedAt(Instant.now()), TTL)).isEmpty();
        verify(valueOperations, never()).set(anyString(), anyString(), eq(TTL));
    }

    @Test
    void connectionFailureIsRetryableNotInvalid() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.find("handle-1"))
                .isInstanceOf(SessionStoreUnavailableException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }
}
