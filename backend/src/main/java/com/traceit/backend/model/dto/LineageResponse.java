package com.traceit.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outward shape of a lineage record; embeddings are not exposed
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineageResponse {
    private PrimaryClaimView primaryClaim;
    private int secondaryClaimCount;

    public static LineageResponse from(LineageRecord record) {
        return new LineageResponse(PrimaryClaimView.from(record.getPrimaryClaim()), record.getSecondaryClaimCount());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PrimaryClaimView {
        private String id;
        private String text;
        private Integer score;
        private String originLabel;
        @JsonProperty("isViral")
        private boolean viral;
        private List<EvidenceItem> evidence;
        // true when the origin could not be traced
        private boolean degraded;

        public static PrimaryClaimView from(PrimaryClaim claim) {
            return new PrimaryClaimView(
                    claim.getId(),
                    claim.getText(),
                    claim.getImportanceScore(),
                    claim.getOriginLabel(),
                    claim.isViral(),
                    claim.getEvidence(),
                    claim.isDegraded());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClaimView {
        private String id;
        private String text;
        private Integer score;

        public static ClaimView from(Claim claim) {
            return new ClaimView(claim.getId(), claim.getText(), claim.getImportanceScore());
        }
    }
}
