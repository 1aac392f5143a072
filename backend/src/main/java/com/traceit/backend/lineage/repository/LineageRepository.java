package com.traceit.backend.lineage.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.lineage.store.KeyValueStore;
import com.traceit.backend.model.dto.Claim;
import com.traceit.backend.model.dto.PrimaryClaim;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/**
 * Key layout, all under the configured prefix:
 * <pre>
 * {id}                        primary claim
 * {id}:secondary:{i}          i-th secondary claim
 * {id}:secondaries            JSON list of the secondary keys, in order
 * </pre>
 * A failed write leaves no primary behind; orphaned secondaries are unreachable and expire with their TTL.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class LineageRepository {

    private static final TypeReference<List<String>> KEY_LIST = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final TraceitProperties properties;

    public void persist(PrimaryClaim primary, List<Claim> secondary) {
        Duration ttl = Duration.ofDays(properties.getLineage().getTtlDays());
        String primaryKey = primaryKey(primary.getId());

        List<String> secondaryKeys = new ArrayList<>(secondary.size());
        for (int i = 0; i < secondary.size(); i++) {
            String key = primaryKey + ":secondary:" + i;
            store.set(key, write(secondary.get(i)), ttl);
            secondaryKeys.add(key);
        }
        store.set(primaryKey + ":secondaries", write(secondaryKeys), ttl);

        // Written last: a primary is only readable once its whole claim set is stored
        store.set(primaryKey, write(primary), ttl);

        log.info("Persisted lineage {} with {} secondary claims", primary.getId(), secondaryKeys.size());
    }

    public Optional<PrimaryClaim> getClaim(String id) {
        return store.get(primaryKey(id)).map(json -> read(json, PrimaryClaim.class));
    }

    public List<String> getSecondaryKeys(String primaryId) {
        return store.get(primaryKey(primaryId) + ":secondaries")
                .map(json -> {
                    try {
                        return objectMapper.readValue(json, KEY_LIST);
                    } catch (JsonProcessingException e) {
                        throw new IllegalStateException("Corrupt secondary key list for " + primaryId, e);
                    }
                })
                .orElse(List.of());
    }

    /**
     * Secondary claims of a run, in the order they were persisted
     */
    public List<Claim> getSecondaryClaims(String primaryId) {
        List<Claim> claims = new ArrayList<>();
        for (String key : getSecondaryKeys(primaryId)) {
            store.get(key).ifPresentOrElse(
                    json -> claims.add(read(json, Claim.class)),
                    () -> log.warn("Secondary claim {} missing from store", key));
        }
        return claims;
    }

    public List<String> getSecondaryClaimIds(String primaryId) {
        return getSecondaryClaims(primaryId).stream()
                .map(Claim::getId)
                .toList();
    }

    private String primaryKey(String id) {
        return properties.getLineage().getKeyPrefix() + id;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lineage value", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored " + type.getSimpleName(), e);
        }
    }
}
