package com.traceit.backend.quota.store;

import com.traceit.backend.model.dto.QuotaState;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Per-user quota state. {@link #compute} must apply the update atomically for a given user.
 */
public interface QuotaStore {

    Optional<QuotaState> find(String userId);

    /**
     * @param update receives the current state, or {@code null} for a user seen for the first time
     * @return the state stored after the update
     */
    QuotaState compute(String userId, UnaryOperator<QuotaState> update);
}
