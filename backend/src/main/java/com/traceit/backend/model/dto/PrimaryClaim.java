package com.traceit.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The selected claim of a run together with its traced origin
 */
@Value
@Builder
@Jacksonized
public class PrimaryClaim {
    public static final String UNKNOWN_ORIGIN = "Unknown";

    String id;
    String text;
    float[] embedding;

    @JsonProperty("score")
    Integer importanceScore;

    String originLabel;

    @JsonProperty("isViral")
    boolean viral;

    @Builder.Default
    List<EvidenceItem> evidence = List.of();

    public static PrimaryClaim traced(Claim claim, String originLabel, boolean viral, List<EvidenceItem> evidence) {
        return PrimaryClaim.builder()
                .id(claim.getId())
                .text(claim.getText())
                .embedding(claim.getEmbedding())
                .importanceScore(claim.getImportanceScore())
                .originLabel(originLabel)
                .viral(viral)
                .evidence(evidence != null ? List.copyOf(evidence) : List.of())
                .build();
    }

    /**
     * Valid but low-confidence result used when tracing fails
     */
    public static PrimaryClaim degraded(Claim claim) {
        return traced(claim, UNKNOWN_ORIGIN, false, List.of());
    }

    @JsonIgnore
    public boolean isDegraded() {
        return UNKNOWN_ORIGIN.equals(originLabel) && !viral && evidence.isEmpty();
    }
}
