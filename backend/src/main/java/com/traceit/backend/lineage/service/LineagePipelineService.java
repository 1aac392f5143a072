package com.traceit.backend.lineage.service;

import com.traceit.backend.ai.service.ClaimExtractionService;
import com.traceit.backend.ai.service.ClaimRankingService;
import com.traceit.backend.ai.service.OriginTracingService;
import com.traceit.backend.exception.PipelineCancelledException;
import com.traceit.backend.exception.QuotaExceededException;
import com.traceit.backend.exception.UnsupportedInputException;
import com.traceit.backend.extraction.ContentNormalizer;
import com.traceit.backend.extraction.ExtractorRouter;
import com.traceit.backend.lineage.repository.LineageRepository;
import com.traceit.backend.model.dto.Claim;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.dto.LineageRecord;
import com.traceit.backend.model.dto.PrimaryClaim;
import com.traceit.backend.model.dto.RankedClaims;
import com.traceit.backend.model.enums.SourcePlatform;
import com.traceit.backend.quota.service.QuotaGuard;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One run: quota check, extract, normalize, claims, rank, trace, persist.
 * Runs on the calling thread; an interrupt ends the run at the next stage boundary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LineagePipelineService {

    private final QuotaGuard quotaGuard;
    private final ExtractorRouter extractorRouter;
    private final ContentNormalizer contentNormalizer;
    private final ClaimExtractionService claimExtractionService;
    private final ClaimRankingService claimRankingService;
    private final OriginTracingService originTracingService;
    private final LineageRepository lineageRepository;

    public LineageRecord runPipeline(String userId, String input) {
        if (input == null || input.isBlank()) {
            throw new UnsupportedInputException("Input must be a URL or non-empty text");
        }

        log.info("📥 Lineage run started for user {}", userId);
        if (!quotaGuard.checkAndConsume(userId)) {
            throw new QuotaExceededException(userId);
        }
        checkCancelled("extraction");

        String trimmed = input.trim();
        ExtractedContent content = SourcePlatform.isHttpUrl(trimmed)
                ? extractorRouter.route(trimmed)
                : ExtractedContent.fromText(trimmed);
        log.info("Ingested {} content for user {}", content.getPlatform().getTag(), userId);
        checkCancelled("normalization");

        String blob = contentNormalizer.normalize(content);
        List<Claim> claims = claimExtractionService.extractClaims(blob);
        checkCancelled("ranking");

        RankedClaims ranked = claimRankingService.rank(claims);
        checkCancelled("tracing");

        PrimaryClaim primary = originTracingService.trace(ranked.getPrimary());
        checkCancelled("persistence");

        lineageRepository.persist(primary, ranked.getSecondary());

        log.info("✅ Lineage run finished for user {}: primary={}, secondaries={}, degraded={}",
                userId, primary.getId(), ranked.getSecondary().size(), primary.isDegraded());
        return LineageRecord.builder()
                .primaryClaim(primary)
                .secondaryClaimCount(ranked.getSecondary().size())
                .build();
    }

    private void checkCancelled(String nextStage) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Lineage run cancelled before {}", nextStage);
            throw new PipelineCancelledException("Run cancelled before " + nextStage);
        }
    }
}
