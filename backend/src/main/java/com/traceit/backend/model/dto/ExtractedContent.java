package com.traceit.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.traceit.backend.model.enums.SourcePlatform;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Uniform record produced by one extractor for one source
 */
@Value
@Builder
@Jacksonized
public class ExtractedContent {
    SourcePlatform platform;

    @JsonProperty("url")
    String sourceUrl;

    String author;
    Instant publishedAt;
    String title;
    String bodyText;

    @Builder.Default
    List<String> mediaRefs = List.of();

    public static ExtractedContent fromText(String text) {
        return ExtractedContent.builder()
                .platform(SourcePlatform.TEXT)
                .bodyText(text.trim())
                .build();
    }
}
