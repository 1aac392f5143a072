package com.traceit.backend.ai.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceit.backend.ai.AIService;
import com.traceit.backend.exception.PipelineCancelledException;
import com.traceit.backend.model.dto.Claim;
import com.traceit.backend.model.dto.EvidenceItem;
import com.traceit.backend.model.dto.PrimaryClaim;
import com.traceit.backend.search.SearchClient;
import com.traceit.backend.search.SearchHit;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the likely origin of the primary claim. Any error in search or interpretation
 * yields {@link PrimaryClaim#degraded(Claim)}; only an interrupted run escapes as a cancellation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OriginTracingService {

    private static final String TRACE_PROMPT = """
            You analyze search results for a claim to determine its origin and viral status.
            Return only a JSON object with "origin" (source name or author) and "viral" (boolean).""";

    private final SearchClient searchClient;
    private final AIService aiService;
    private final ObjectMapper objectMapper;

    public PrimaryClaim trace(Claim claim) {
        try {
            List<SearchHit> hits = searchClient.search(claim.getText());
            log.debug("Search returned {} hits for claim {}", hits.size(), claim.getId());

            String response = aiService.complete(TRACE_PROMPT,
                    "Claim: " + claim.getText() + "\n\nSearch Results: " + objectMapper.writeValueAsString(hits));
            if (response == null || response.isBlank()) {
                throw new IllegalStateException("Empty response from reasoning service");
            }

            JsonNode analysis = objectMapper.readTree(AIService.extractJson(response));
            String origin = analysis.path("origin").asText("");
            boolean viral = analysis.has("viral")
                    ? analysis.path("viral").asBoolean(false)
                    : analysis.path("isViral").asBoolean(false);

            List<EvidenceItem> evidence = hits.stream()
                    .map(hit -> EvidenceItem.builder()
                            .url(hit.getUrl())
                            .title(hit.getTitle())
                            .snippet(hit.getSnippet())
                            .build())
                    .toList();

            PrimaryClaim traced = PrimaryClaim.traced(claim,
                    origin.isBlank() ? PrimaryClaim.UNKNOWN_ORIGIN : origin, viral, evidence);
            log.info("Traced claim {}: origin={}, viral={}, evidence={}", claim.getId(), traced.getOriginLabel(), viral, evidence.size());
            return traced;

        } catch (Exception e) {
            if (isInterruption(e)) {
                // Blocking clients may wrap the interrupt and clear the flag
                Thread.currentThread().interrupt();
                log.info("Tracing of claim {} cancelled", claim.getId());
                throw new PipelineCancelledException("Tracing cancelled");
            }
            log.warn("⚠️ Tracing failed for claim {}, returning unknown origin: {}", claim.getId(), e.getMessage());
            return PrimaryClaim.degraded(claim);
        }
    }

    private static boolean isInterruption(Throwable error) {
        if (Thread.currentThread().isInterrupted()) return true;
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) return true;
        }
        return false;
    }
}
