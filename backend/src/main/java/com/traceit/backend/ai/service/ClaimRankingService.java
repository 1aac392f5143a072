package com.traceit.backend.ai.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceit.backend.ai.AIService;
import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.config.TraceitProperties.RankingFallback;
import com.traceit.backend.exception.ExtractionFailedException;
import com.traceit.backend.model.dto.Claim;
import com.traceit.backend.model.dto.RankedClaims;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores claims for specificity, verifiability and importance and picks the primary one.
 * When scores cannot be obtained the configured {@link RankingFallback} applies.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClaimRankingService {

    private static final String RANKING_PROMPT = """
            You are an AI that ranks claims based on how specific, verifiable, and important they are.
            Assign a score from 0 to 100 to each claim.""";

    private static final String RANKING_REQUEST = """
            Rank these claims by how specific, verifiable, and important they are.
            Return only a JSON object of the form {"scores": [score1, score2, ...]} with one score per claim, in the order given.

            %s""";

    private final AIService aiService;
    private final ObjectMapper objectMapper;
    private final TraceitProperties properties;

    public RankedClaims rank(List<Claim> claims) {
        if (claims == null || claims.isEmpty()) {
            throw new ExtractionFailedException("No claims to rank");
        }

        Optional<List<Integer>> scores = requestScores(claims);
        if (scores.isEmpty()) {
            return fallback(claims);
        }

        List<Claim> scored = IntStream.range(0, claims.size())
                .mapToObj(i -> claims.get(i).withImportanceScore(scores.get().get(i)))
                .collect(Collectors.toCollection(ArrayList::new));
        // Stable sort, equal scores keep extraction order
        scored.sort(Comparator.comparing(Claim::getImportanceScore).reversed());

        log.info("Ranked {} claims, primary score={}", scored.size(), scored.get(0).getImportanceScore());
        return new RankedClaims(scored.get(0), List.copyOf(scored.subList(1, scored.size())), true);
    }

    private Optional<List<Integer>> requestScores(List<Claim> claims) {
        String numbered = IntStream.range(0, claims.size())
                .mapToObj(i -> (i + 1) + ". " + claims.get(i).getText())
                .collect(Collectors.joining("\n\n"));

        String response;
        try {
            response = aiService.complete(RANKING_PROMPT, String.format(RANKING_REQUEST, numbered));
        } catch (RuntimeException e) {
            log.warn("Claim ranking request failed: {}", e.getMessage());
            return Optional.empty();
        }
        return parseScores(response, claims.size());
    }

    /**
     * Accepts {"scores": [..]} or a bare array; entries may be numbers or {"score": n}
     */
    Optional<List<Integer>> parseScores(String response, int expected) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(AIService.extractJson(response));
        } catch (JsonProcessingException e) {
            log.warn("Could not parse claim scores: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        JsonNode array = root.isArray() ? root : root.path("scores");
        if (!array.isArray() || array.size() < expected) {
            log.warn("Claim score response has no usable scores array");
            return Optional.empty();
        }

        List<Integer> scores = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            JsonNode entry = array.get(i);
            JsonNode value = entry.isObject() ? entry.path("score") : entry;
            if (!value.isNumber()) {
                log.warn("Claim score {} is not numeric: {}", i + 1, entry);
                return Optional.empty();
            }
            scores.add(Math.max(0, Math.min(100, (int) Math.round(value.asDouble()))));
        }
        return Optional.of(scores);
    }

    private RankedClaims fallback(List<Claim> claims) {
        if (properties.getRanking().getFallback() == RankingFallback.FAIL) {
            throw new ExtractionFailedException("Claim scores could not be parsed");
        }
        log.warn("⚠️ Claim scores unavailable, using extraction order: first claim becomes primary");
        return new RankedClaims(claims.get(0), List.copyOf(claims.subList(1, claims.size())), false);
    }
}
