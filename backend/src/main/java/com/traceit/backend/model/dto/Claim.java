package com.traceit.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Claim {
    String id;
    String text;
    float[] embedding;

    @With
    @JsonProperty("score")
    Integer importanceScore;
}
