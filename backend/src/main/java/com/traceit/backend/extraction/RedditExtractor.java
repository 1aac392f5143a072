package com.traceit.backend.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.exception.ContentExtractionException;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Discussion threads, read through the platform's public JSON listing.
 */
@Component
@Order(1)
@Slf4j
@RequiredArgsConstructor
public class RedditExtractor implements ContentExtractor {

    private static final Pattern POST_ID_PATTERN = Pattern.compile("/comments/([a-zA-Z0-9]+)");
    private static final String LISTING_URL = "https://www.reddit.com/comments/%s.json";

    private final TraceitProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isEligible(String url) {
        return SourcePlatform.REDDIT.matchesUrl(url);
    }

    @Override
    public ExtractedContent extract(String url) {
        String postId = extractPostId(url);
        log.debug("Fetching Reddit listing for post {}", postId);

        String json;
        try {
            json = fetchListing(postId);
        } catch (IOException e) {
            throw new ContentExtractionException("Failed to fetch Reddit post " + postId + ": " + e.getMessage(), e);
        }

        try {
            return mapListing(url, objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ContentExtractionException("Malformed Reddit listing for post " + postId, e);
        }
    }

    String extractPostId(String url) {
        Matcher matcher = POST_ID_PATTERN.matcher(URI.create(url.trim()).getPath());
        if (!matcher.find()) {
            throw new ContentExtractionException("Invalid Reddit URL format");
        }
        return matcher.group(1);
    }

    protected String fetchListing(String postId) throws IOException {
        return Jsoup.connect(String.format(LISTING_URL, postId))
                .userAgent(properties.getExtraction().getRedditUserAgent())
                .timeout(properties.getExtraction().getTimeoutSeconds() * 1000)
                .ignoreContentType(true)
                .followRedirects(true)
                .execute()
                .body();
    }

    ExtractedContent mapListing(String url, JsonNode listing) {
        JsonNode post = listing.path(0).path("data").path("children").path(0).path("data");
        if (post.isMissingNode() || !post.isObject()) {
            throw new ContentExtractionException("Reddit listing contains no post");
        }

        List<String> mediaRefs = new ArrayList<>();
        String videoUrl = post.path("media").path("reddit_video").path("fallback_url").asText("");
        String previewUrl = post.path("preview").path("images").path(0).path("source").path("url").asText("");
        if (post.path("is_video").asBoolean(false) && !videoUrl.isEmpty()) {
            mediaRefs.add(videoUrl);
        } else if (!previewUrl.isEmpty()) {
            mediaRefs.add(previewUrl.replace("&amp;", "&"));
        }

        Instant publishedAt = post.hasNonNull("created_utc")
                ? Instant.ofEpochSecond(post.get("created_utc").asLong())
                : null;

        return ExtractedContent.builder()
                .platform(SourcePlatform.REDDIT)
                .sourceUrl(url)
                .author(post.path("author").asText(""))
                .publishedAt(publishedAt)
                .title(post.path("title").asText(""))
                .bodyText(post.path("selftext").asText(""))
                .mediaRefs(mediaRefs)
                .build();
    }
}
