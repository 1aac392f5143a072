package com.traceit.backend.ai.service;

import com.traceit.backend.ai.AIService;
import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.exception.ExtractionFailedException;
import com.traceit.backend.model.dto.Claim;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives up to five candidate claims from a normalized content blob
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClaimExtractionService {

    private static final String EXTRACTION_PROMPT = """
            You are an AI that extracts key claims from content.
            Identify the most important assertions, claims, or ideas in the text.
            Return exactly %d distinct claims, one per line, without any introduction or commentary.""";

    // "1.", "2)", "3 -", "-", "*", "•"
    private static final Pattern ENUMERATION_MARKER = Pattern.compile("^\\s*(?:\\d+\\s*[.):-]|[-*•])\\s*");

    private final AIService aiService;
    private final TraceitProperties properties;

    public List<Claim> extractClaims(String blob) {
        if (blob == null || blob.isBlank()) {
            throw new ExtractionFailedException("No content to extract claims from");
        }

        int maxClaims = properties.getClaims().getMaxClaims();
        String response;
        try {
            response = aiService.complete(
                    String.format(EXTRACTION_PROMPT, maxClaims),
                    AIService.truncateContent(blob, properties.getClaims().getMaxBlobChars()));
        } catch (RuntimeException e) {
            log.error("❌ Claim extraction request failed: {}", e.getMessage());
            throw new ExtractionFailedException("Failed to extract claims from content", e);
        }

        if (response == null || response.isBlank()) {
            throw new ExtractionFailedException("Empty response from reasoning service");
        }

        List<String> texts = response.lines()
                .map(line -> ENUMERATION_MARKER.matcher(line).replaceFirst("").trim())
                .filter(line -> !line.isEmpty())
                .limit(maxClaims)
                .toList();
        if (texts.isEmpty()) {
            throw new ExtractionFailedException("Reasoning service returned no claims");
        }

        List<Claim> claims = new ArrayList<>(texts.size());
        for (String text : texts) {
            claims.add(Claim.builder()
                    .id(UUID.randomUUID().toString())
                    .text(text)
                    .embedding(embed(text))
                    .build());
        }

        log.info("Extracted {} claims from content blob of {} characters", claims.size(), blob.length());
        return claims;
    }

    private float[] embed(String text) {
        try {
            return aiService.embed(text);
        } catch (RuntimeException e) {
            log.error("❌ Embedding request failed: {}", e.getMessage());
            throw new ExtractionFailedException("Failed to create claim embedding", e);
        }
    }
}
