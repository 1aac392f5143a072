package com.traceit.backend.extraction;

import com.traceit.backend.model.dto.ExtractedContent;

/**
 * One source-specific way of turning a URL into {@link ExtractedContent}.
 */
public interface ContentExtractor {

    /**
     * Cheap, non-network check whether this extractor should be tried for the URL
     */
    boolean isEligible(String url);

    /**
     * Fetch and map the URL. Throws {@link com.traceit.backend.exception.ContentExtractionException}
     * when this strategy cannot produce content.
     */
    ExtractedContent extract(String url);

    default String name() {
        return getClass().getSimpleName();
    }
}
