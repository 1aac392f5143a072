package com.traceit.backend.quota.store;

import com.traceit.backend.model.dto.QuotaState;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Process-wide quota state. Lost on restart.
 */
@Component
public class InMemoryQuotaStore implements QuotaStore {

    private final Map<String, QuotaState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<QuotaState> find(String userId) {
        return Optional.ofNullable(states.get(userId));
    }

    @Override
    public QuotaState compute(String userId, UnaryOperator<QuotaState> update) {
        return states.compute(userId, (key, current) -> update.apply(current));
    }
}
