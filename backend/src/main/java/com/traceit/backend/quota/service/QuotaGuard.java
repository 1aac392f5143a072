package com.traceit.backend.quota.service;

import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.model.dto.QuotaState;
import com.traceit.backend.quota.event.QuotaConsumedEvent;
import com.traceit.backend.quota.store.QuotaStore;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Daily per-user search budget. A denied check never decrements.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaGuard {

    private final QuotaStore quotaStore;
    private final TraceitProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public boolean checkAndConsume(String userId) {
        Instant now = clock.instant();
        AtomicBoolean granted = new AtomicBoolean(false);

        QuotaState state = quotaStore.compute(userId, current -> {
            QuotaState active = rollOver(current, now);
            if (active.getRemaining() <= 0) {
                return active;
            }
            granted.set(true);
            return active.withRemaining(active.getRemaining() - 1);
        });

        if (granted.get()) {
            log.debug("✅ Quota granted for user {}: remaining={}/{}", userId, state.getRemaining(), state.getLimit());
        } else {
            log.warn("⚠️ Quota exhausted for user {} until {}", userId, state.getWindowResetAt());
        }
        eventPublisher.publishEvent(new QuotaConsumedEvent(userId, granted.get(), state.getRemaining(), now));
        return granted.get();
    }

    /**
     * Current state without consuming. A user never seen before reports the full budget.
     */
    public QuotaState status(String userId) {
        Instant now = clock.instant();
        return quotaStore.find(userId)
                .map(state -> rollOver(state, now))
                .orElseGet(() -> freshWindow(now));
    }

    public QuotaState reset(String userId) {
        Instant now = clock.instant();
        QuotaState state = quotaStore.compute(userId, current -> freshWindow(now));
        log.info("Quota reset for user {}: remaining={}", userId, state.getRemaining());
        return state;
    }

    private QuotaState rollOver(QuotaState current, Instant now) {
        if (current == null || !now.isBefore(current.getWindowResetAt())) {
            return freshWindow(now);
        }
        return current;
    }

    private QuotaState freshWindow(Instant now) {
        int limit = properties.getQuota().getDailyLimit();
        return QuotaState.builder()
                .remaining(limit)
                .limit(limit)
                .windowResetAt(nextBoundary(now))
                .build();
    }

    /**
     * First midnight strictly after {@code now} in the configured zone
     */
    Instant nextBoundary(Instant now) {
        ZoneId zone = ZoneId.of(properties.getQuota().getZone());
        LocalDate today = LocalDate.ofInstant(now, zone);
        return today.plusDays(1).atStartOfDay(zone).toInstant();
    }
}
