package com.traceit.backend.extraction;

import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.exception.ContentExtractionException;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Any http(s) page fetched as static markup and parsed as an article.
 */
@Component
@Order(3)
@Slf4j
@RequiredArgsConstructor
public class GenericArticleExtractor implements ContentExtractor {

    private static final Map<String, String> DEFAULT_HEADERS = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5");

    private final TraceitProperties properties;
    private final ArticleContentParser articleContentParser;

    @Override
    public boolean isEligible(String url) {
        return SourcePlatform.isHttpUrl(url);
    }

    @Override
    public ExtractedContent extract(String url) {
        String html;
        try {
            html = fetch(url);
        } catch (IOException e) {
            throw new ContentExtractionException("Failed to fetch article: " + e.getMessage(), e);
        }

        ExtractedContent content = articleContentParser.toContent(url, html);
        log.debug("Parsed article from {}: title={}, body_length={}", url, content.getTitle(), content.getBodyText().length());
        return content;
    }

    protected String fetch(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(properties.getExtraction().getUserAgent())
                .headers(DEFAULT_HEADERS)
                .timeout(properties.getExtraction().getTimeoutSeconds() * 1000)
                .followRedirects(true)
                .execute()
                .body();
    }
}
