package com.traceit.backend.extraction;

import com.traceit.backend.exception.PipelineCancelledException;
import com.traceit.backend.exception.UnsupportedInputException;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the extractors in fixed priority order and returns the first content produced.
 * A failing extractor never ends the chain; later, broader extractors are still tried.
 */
@Service
@Slf4j
public class ExtractorRouter {

    private final List<ContentExtractor> extractors;

    public ExtractorRouter(List<ContentExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
        log.info("Extractor chain: {}", this.extractors.stream()
                .map(ContentExtractor::name)
                .collect(Collectors.joining(" -> ")));
    }

    public ExtractedContent route(String url) {
        if (!SourcePlatform.isHttpUrl(url)) {
            throw new UnsupportedInputException("Invalid URL: " + url);
        }

        SourcePlatform platform = SourcePlatform.fromUrl(url);
        log.info("Routing {} ({})", url, platform != null ? platform.getTag() : "no platform match");

        List<String> failures = new ArrayList<>();
        return extractors.stream()
                .filter(extractor -> isEligible(extractor, url))
                .map(extractor -> attempt(extractor, url, failures))
                .flatMap(Optional::stream)
                .findFirst()
                .orElseThrow(() -> new UnsupportedInputException(
                        "No suitable extractor found for URL: " + url
                                + (failures.isEmpty() ? "" : " (" + String.join("; ", failures) + ")")));
    }

    private boolean isEligible(ContentExtractor extractor, String url) {
        try {
            return extractor.isEligible(url);
        } catch (RuntimeException e) {
            log.warn("Eligibility check of {} failed for {}: {}", extractor.name(), url, e.getMessage());
            return false;
        }
    }

    private Optional<ExtractedContent> attempt(ContentExtractor extractor, String url, List<String> failures) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineCancelledException("Extraction cancelled");
        }

        try {
            ExtractedContent content = extractor.extract(url);
            if (content == null) {
                failures.add(extractor.name() + ": no content");
                return Optional.empty();
            }
            log.info("✅ {} extracted {} content from {}", extractor.name(), content.getPlatform().getTag(), url);
            return Optional.of(content);
        } catch (PipelineCancelledException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Extractor {} failed for {}: {}", extractor.name(), url, e.getMessage());
            failures.add(extractor.name() + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
