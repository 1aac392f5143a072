package com.traceit.backend.lineage.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisKeyValueStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = new RedisKeyValueStore(redisTemplate);
    }

    @Test
    @DisplayName("Connecting repeatedly pings the server once")
    @SuppressWarnings("unchecked")
    void idempotentConnect() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

        store.connect();
        store.connect();
        store.connect();

        assertThat(store.isConnected()).isTrue();
        verify(redisTemplate, times(1)).execute(any(RedisCallback.class));
    }

    @Test
    @DisplayName("A failed connection is retried on the next call")
    @SuppressWarnings("unchecked")
    void failedConnect() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("refused"))
                .thenReturn("PONG");

        assertThatThrownBy(store::connect).isInstanceOf(RedisConnectionFailureException.class);
        assertThat(store.isConnected()).isFalse();

        store.connect();
        assertThat(store.isConnected()).isTrue();
    }

    @Test
    @DisplayName("Writes with expiry and reads values back")
    @SuppressWarnings("unchecked")
    void setAndGet() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("claim:p1")).thenReturn("{\"id\":\"p1\"}");

        store.set("claim:p1", "{\"id\":\"p1\"}", Duration.ofDays(90));

        verify(valueOperations).set("claim:p1", "{\"id\":\"p1\"}", Duration.ofDays(90));
        assertThat(store.get("claim:p1")).contains("{\"id\":\"p1\"}");
        assertThat(store.get("claim:p1")).isPresent();
    }
}
