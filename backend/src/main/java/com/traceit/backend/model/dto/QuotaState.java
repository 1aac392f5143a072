package com.traceit.backend.model.dto;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

@Value
@With
@Builder
@Jacksonized
public class QuotaState {
    int remaining;
    int limit;
    Instant windowResetAt;
}
