package com.traceit.backend.model.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class RankedClaims {
    Claim primary;
    List<Claim> secondary;
    // false when the fallback ordering was used
    boolean scored;
}
