package com.traceit.backend.lineage.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redisTemplate;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    @Override
    public void connect() {
        if (connected.get()) {
            return;
        }
        synchronized (connected) {
            if (connected.get()) {
                return;
            }
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            connected.set(true);
            log.info("✅ Connected to lineage store ({})", pong);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        connect();
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            redisTemplate.opsForValue().set(key, value, ttl);
        } else {
            redisTemplate.opsForValue().set(key, value);
        }
    }

    @Override
    public Optional<String> get(String key) {
        connect();
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    public boolean isConnected() {
        return connected.get();
    }
}
