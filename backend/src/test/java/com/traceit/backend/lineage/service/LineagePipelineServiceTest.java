package com.traceit.backend.lineage.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceit.backend.ai.service.ClaimExtractionService;
import com.traceit.backend.ai.service.ClaimRankingService;
import com.traceit.backend.ai.service.OriginTracingService;
import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.exception.ContentTooSmallException;
import com.traceit.backend.exception.ExtractionFailedException;
import com.traceit.backend.exception.PipelineCancelledException;
import com.traceit.backend.exception.QuotaExceededException;
import com.traceit.backend.exception.UnsupportedInputException;
import com.traceit.backend.extraction.ContentNormalizer;
import com.traceit.backend.extraction.ExtractorRouter;
import com.traceit.backend.lineage.repository.LineageRepository;
import com.traceit.backend.model.dto.Claim;
import com.traceit.backend.model.dto.LineageRecord;
import com.traceit.backend.model.dto.PrimaryClaim;
import com.traceit.backend.model.dto.QuotaState;
import com.traceit.backend.model.dto.RankedClaims;
import com.traceit.backend.quota.service.QuotaGuard;
import com.traceit.backend.quota.store.InMemoryQuotaStore;
import com.traceit.backend.support.Fixtures;
import com.traceit.backend.support.InMemoryKeyValueStore;
import com.traceit.backend.support.MutableClock;
import com.traceit.backend.support.StubExtractor;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LineagePipelineServiceTest {

    private static final String THREAD_URL = "https://www.reddit.com/r/aww/comments/kv8q8d/";
    private static final String ARTICLE_URL = "https://unknown-site.example/story";
    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");
    private static final Instant NEXT_MIDNIGHT = Instant.parse("2024-06-02T00:00:00Z");

    @Mock
    private ClaimExtractionService claimExtractionService;

    @Mock
    private ClaimRankingService claimRankingService;

    @Mock
    private OriginTracingService originTracingService;

    private InMemoryQuotaStore quotaStore;
    private InMemoryKeyValueStore keyValueStore;
    private LineageRepository lineageRepository;
    private QuotaGuard quotaGuard;

    private StubExtractor reddit;
    private StubExtractor generic;
    private StubExtractor headless;

    private final Claim c1 = Fixtures.claim("c1", "The cat opened the door by herself.");
    private final Claim c2 = Fixtures.claim("c2", "Cats can learn to open doors by watching people.");
    private final Claim c3 = Fixtures.claim("c3", "It took one week of observation.");

    @BeforeEach
    void setUp() {
        TraceitProperties properties = new TraceitProperties();
        quotaStore = new InMemoryQuotaStore();
        keyValueStore = new InMemoryKeyValueStore();
        lineageRepository = new LineageRepository(keyValueStore, new ObjectMapper(), properties);
        quotaGuard = new QuotaGuard(quotaStore, properties, event -> {
        }, new MutableClock(NOW));

        reddit = StubExtractor.succeeding("RedditExtractor", Fixtures.redditPost(THREAD_URL));
        generic = StubExtractor.failing("GenericArticleExtractor", new ContentTooSmallException("Markup too small: 310 bytes"));
        headless = StubExtractor.failing("HeadlessFallbackExtractor", new ContentTooSmallException("Article body too small: 12 characters"));
    }

    private LineagePipelineService pipeline(StubExtractor... extractors) {
        return new LineagePipelineService(
                quotaGuard,
                new ExtractorRouter(List.of(extractors)),
                new ContentNormalizer(),
                claimExtractionService,
                claimRankingService,
                originTracingService,
                lineageRepository);
    }

    private void givenRemaining(String userId, int remaining) {
        quotaStore.compute(userId, current -> QuotaState.builder()
                .remaining(remaining)
                .limit(10)
                .windowResetAt(NEXT_MIDNIGHT)
                .build());
    }

    @Test
    @DisplayName("A thread URL runs every stage, persists the lineage and consumes one search")
    void threadEndToEnd() {
        // given
        givenRemaining("alice", 3);
        List<Claim> claims = List.of(c1, c2, c3);
        Claim scoredPrimary = c2.withImportanceScore(88);
        PrimaryClaim traced = PrimaryClaim.degraded(scoredPrimary);
        when(claimExtractionService.extractClaims("My cat learned to open doors\n\n"
                + "She watched me do it for a week and then just did it.\n\n"
                + "Media URLs: https://i.redd.it/door.jpg")).thenReturn(claims);
        when(claimRankingService.rank(claims)).thenReturn(new RankedClaims(
                scoredPrimary, List.of(c3.withImportanceScore(60), c1.withImportanceScore(20)), true));
        when(originTracingService.trace(scoredPrimary)).thenReturn(traced);

        // when
        LineageRecord record = pipeline(reddit, generic, headless).runPipeline("alice", THREAD_URL);

        // then
        assertThat(record.getPrimaryClaim()).isEqualTo(traced);
        assertThat(record.getSecondaryClaimCount()).isEqualTo(2);
        assertThat(quotaStore.find("alice").orElseThrow().getRemaining()).isEqualTo(2);
        assertThat(reddit.calls()).containsExactly(THREAD_URL);
        assertThat(generic.calls()).isEmpty();
        assertThat(lineageRepository.getClaim("c2")).contains(traced);
        assertThat(lineageRepository.getSecondaryClaimIds("c2")).containsExactly("c3", "c1");
    }

    @Test
    @DisplayName("An exhausted user is refused before any extractor runs")
    void quotaExhausted() {
        givenRemaining("bob", 0);

        assertThatThrownBy(() -> pipeline(reddit, generic, headless).runPipeline("bob", THREAD_URL))
                .isInstanceOf(QuotaExceededException.class)
                .hasMessage("Daily search quota exceeded");

        assertThat(reddit.calls()).isEmpty();
        assertThat(generic.calls()).isEmpty();
        assertThat(headless.calls()).isEmpty();
        assertThat(quotaStore.find("bob").orElseThrow().getRemaining()).isZero();
        verifyNoInteractions(claimExtractionService, claimRankingService, originTracingService);
        assertThat(keyValueStore.values()).isEmpty();
    }

    @Test
    @DisplayName("An unmatched URL whose fallbacks both fail the size gates is unsupported")
    void unmatchedUrl() {
        StubExtractor redditOnly = StubExtractor.ineligible("RedditExtractor");

        assertThatThrownBy(() -> pipeline(redditOnly, generic, headless).runPipeline("alice", ARTICLE_URL))
                .isInstanceOf(UnsupportedInputException.class)
                .hasMessageContaining("Markup too small")
                .hasMessageContaining("Article body too small");

        assertThat(generic.calls()).containsExactly(ARTICLE_URL);
        assertThat(headless.calls()).containsExactly(ARTICLE_URL);
        verifyNoInteractions(claimExtractionService);
        assertThat(keyValueStore.values()).isEmpty();
    }

    @Test
    @DisplayName("Raw text skips the extractor chain")
    void rawText() {
        String text = "Drinking coffee prevents colds.";
        when(claimExtractionService.extractClaims(text)).thenReturn(List.of(c1));
        when(claimRankingService.rank(List.of(c1))).thenReturn(new RankedClaims(c1, List.of(), false));
        when(originTracingService.trace(c1)).thenReturn(PrimaryClaim.degraded(c1));

        LineageRecord record = pipeline(reddit, generic, headless).runPipeline("carol", "  " + text + "  ");

        assertThat(record.getSecondaryClaimCount()).isZero();
        assertThat(reddit.calls()).isEmpty();
        assertThat(generic.calls()).isEmpty();
        assertThat(quotaStore.find("carol").orElseThrow().getRemaining()).isEqualTo(9);
    }

    @Test
    @DisplayName("Blank input is rejected without consuming quota")
    void blankInput() {
        assertThatThrownBy(() -> pipeline(reddit).runPipeline("alice", "   "))
                .isInstanceOf(UnsupportedInputException.class);

        assertThat(quotaStore.find("alice")).isEmpty();
    }

    @Test
    @DisplayName("Claim extraction failures end the run and nothing is persisted")
    void extractionFailure() {
        when(claimExtractionService.extractClaims("Some text"))
                .thenThrow(new ExtractionFailedException("Empty response from reasoning service"));

        assertThatThrownBy(() -> pipeline(reddit).runPipeline("alice", "Some text"))
                .isInstanceOf(ExtractionFailedException.class);

        verifyNoInteractions(claimRankingService, originTracingService);
        assertThat(keyValueStore.values()).isEmpty();
    }

    @Test
    @DisplayName("An interrupted worker stops at the next stage boundary")
    void cancelled() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> pipeline(reddit).runPipeline("alice", "Some text"))
                    .isInstanceOf(PipelineCancelledException.class);
        } finally {
            Thread.interrupted();
        }

        verifyNoInteractions(claimExtractionService);
    }
}
