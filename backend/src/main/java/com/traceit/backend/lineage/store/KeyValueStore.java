package com.traceit.backend.lineage.store;

import java.time.Duration;
import java.util.Optional;

/**
 * String key-value store holding lineage records
 */
public interface KeyValueStore {

    /**
     * Establish the connection. Safe to call any number of times.
     */
    void connect();

    void set(String key, String value, Duration ttl);

    Optional<String> get(String key);
}
