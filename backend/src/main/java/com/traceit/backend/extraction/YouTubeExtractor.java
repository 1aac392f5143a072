package com.traceit.backend.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.exception.ContentExtractionException;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Video pages, described by the external yt-dlp metadata tool.
 * Without the tool a placeholder record is returned instead of failing.
 */
@Component
@Order(2)
@Slf4j
@RequiredArgsConstructor
public class YouTubeExtractor implements ContentExtractor {

    static final String PLACEHOLDER_TITLE = "YouTube video";
    private static final DateTimeFormatter UPLOAD_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final TraceitProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isEligible(String url) {
        return SourcePlatform.YOUTUBE.matchesUrl(url);
    }

    @Override
    public ExtractedContent extract(String url) {
        Optional<String> output = runMetadataTool(url);
        if (output.isEmpty()) {
            log.warn("yt-dlp is not available, returning placeholder content for {}", url);
            return placeholder(url);
        }

        try {
            return mapMetadata(url, objectMapper.readTree(output.get()));
        } catch (JsonProcessingException e) {
            throw new ContentExtractionException("Failed to extract YouTube video: malformed metadata", e);
        }
    }

    /**
     * Run the metadata tool; empty when the binary cannot be started
     */
    protected Optional<String> runMetadataTool(String url) {
        String binary = properties.getExtraction().getYtdlpBinary();
        int timeoutSeconds = properties.getExtraction().getYtdlpTimeoutSeconds();

        Process process;
        try {
            process = new ProcessBuilder(binary, "--dump-json", "--no-download", url)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            log.debug("Could not start {}: {}", binary, e.getMessage());
            return Optional.empty();
        }

        try {
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new ContentExtractionException("yt-dlp timed out after " + timeoutSeconds + "s");
            }
            if (process.exitValue() != 0) {
                throw new ContentExtractionException("yt-dlp exited with status " + process.exitValue());
            }
            return Optional.of(stdout.get(timeoutSeconds, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentExtractionException("yt-dlp interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ContentExtractionException("Failed to read yt-dlp output: " + e.getMessage(), e);
        } finally {
            process.destroyForcibly();
        }
    }

    ExtractedContent mapMetadata(String url, JsonNode data) {
        String title = data.path("title").asText("");
        String description = data.path("description").asText("");
        String thumbnail = data.path("thumbnail").asText("");

        return ExtractedContent.builder()
                .platform(SourcePlatform.YOUTUBE)
                .sourceUrl(url)
                .author(data.path("uploader").asText(""))
                .publishedAt(parseUploadDate(data.path("upload_date").asText(null)))
                .title(title)
                .bodyText(!description.isEmpty() ? description : title)
                .mediaRefs(!thumbnail.isEmpty() ? List.of(thumbnail) : List.of())
                .build();
    }

    /**
     * YYYYMMDD to the start of that day in UTC
     */
    static Instant parseUploadDate(String uploadDate) {
        if (uploadDate == null || !uploadDate.matches("\\d{8}")) {
            return null;
        }
        try {
            return LocalDate.parse(uploadDate, UPLOAD_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Invalid upload date {}: {}", uploadDate, e.getMessage());
            return null;
        }
    }

    private ExtractedContent placeholder(String url) {
        return ExtractedContent.builder()
                .platform(SourcePlatform.YOUTUBE)
                .sourceUrl(url)
                .title(PLACEHOLDER_TITLE)
                .bodyText("")
                .build();
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
