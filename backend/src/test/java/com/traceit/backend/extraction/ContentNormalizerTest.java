package com.traceit.backend.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentNormalizerTest {

    private final ContentNormalizer normalizer = new ContentNormalizer();

    @Test
    @DisplayName("Joins title and body and appends media references")
    void titleBodyAndMedia() {
        ExtractedContent content = ExtractedContent.builder()
                .platform(SourcePlatform.REDDIT)
                .title("  My cat learned to open doors ")
                .bodyText("She watched me do it.")
                .mediaRefs(List.of("https://i.redd.it/a.jpg", "https://i.redd.it/b.jpg"))
                .build();

        assertThat(normalizer.normalize(content)).isEqualTo(
                "My cat learned to open doors\n\nShe watched me do it.\n\nMedia URLs: https://i.redd.it/a.jpg, https://i.redd.it/b.jpg");
    }

    @Test
    @DisplayName("Skips empty parts")
    void skipsEmptyParts() {
        ExtractedContent noTitle = ExtractedContent.builder()
                .platform(SourcePlatform.ARTICLE)
                .title("")
                .bodyText("Only the body.")
                .build();
        ExtractedContent noBody = ExtractedContent.builder()
                .platform(SourcePlatform.YOUTUBE)
                .title("YouTube video")
                .bodyText("")
                .build();

        assertThat(normalizer.normalize(noTitle)).isEqualTo("Only the body.");
        assertThat(normalizer.normalize(noBody)).isEqualTo("YouTube video");
    }

    @Test
    @DisplayName("Raw text input passes through unchanged")
    void rawText() {
        assertThat(normalizer.normalize(ExtractedContent.fromText("  Drinking coffee prevents colds. ")))
                .isEqualTo("Drinking coffee prevents colds.");
    }
}
