package com.traceit.backend.extraction;

import com.traceit.backend.model.dto.ExtractedContent;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Merges extracted content into the single text blob used for claim extraction.
 */
@Component
public class ContentNormalizer {

    public String normalize(ExtractedContent content) {
        String text = Stream.of(content.getTitle(), content.getBodyText())
                .filter(part -> part != null && !part.isBlank())
                .map(String::trim)
                .collect(Collectors.joining("\n\n"));

        List<String> mediaRefs = content.getMediaRefs();
        String media = mediaRefs != null && !mediaRefs.isEmpty()
                ? "Media URLs: " + String.join(", ", mediaRefs)
                : "";

        return (text + "\n\n" + media).trim();
    }
}
