package com.traceit.backend.quota.event;

import java.time.Instant;
import lombok.Value;

/**
 * Published for every quota decision, granted or denied
 */
@Value
public class QuotaConsumedEvent {
    String userId;
    boolean granted;
    int remaining;
    Instant occurredAt;
}
