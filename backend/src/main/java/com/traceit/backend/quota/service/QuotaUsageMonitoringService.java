package com.traceit.backend.quota.service;

import com.traceit.backend.quota.entity.QuotaUsageLog;
import com.traceit.backend.quota.event.QuotaConsumedEvent;
import com.traceit.backend.quota.repository.QuotaUsageLogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Records every quota decision and reports per-user usage
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaUsageMonitoringService {

    private final QuotaUsageLogRepository quotaUsageLogRepository;
    private final Clock clock;

    @Async("usageTaskExecutor")
    @EventListener
    public void onQuotaConsumed(QuotaConsumedEvent event) {
        try {
            quotaUsageLogRepository.save(QuotaUsageLog.builder()
                    .userId(event.getUserId())
                    .granted(event.isGranted())
                    .remaining(event.getRemaining())
                    .usedAt(event.getOccurredAt())
                    .build());
        } catch (DataAccessException e) {
            // The quota decision already stands; only the log row is lost
            log.error("❌ Failed to record quota usage for user {}: {}", event.getUserId(), e.getMessage());
        }
    }

    public Map<String, Object> getUsageStats(String userId) {
        Instant now = clock.instant();
        Instant oneDayAgo = now.minus(Duration.ofDays(1));
        Instant oneWeekAgo = now.minus(Duration.ofDays(7));

        List<QuotaUsageLog> recent = quotaUsageLogRepository.findTop20ByUserIdOrderByUsedAtDesc(userId);

        return Map.of(
                "userId", userId,
                "daily", Map.of(
                        "granted", count(userId, true, oneDayAgo),
                        "denied", count(userId, false, oneDayAgo)
                ),
                "weekly", Map.of(
                        "granted", count(userId, true, oneWeekAgo),
                        "denied", count(userId, false, oneWeekAgo)
                ),
                "recent", recent,
                "timestamp", now
        );
    }

    private long count(String userId, boolean granted, Instant since) {
        Long count = quotaUsageLogRepository.countByUserSince(userId, granted, since);
        return count != null ? count : 0L;
    }
}
