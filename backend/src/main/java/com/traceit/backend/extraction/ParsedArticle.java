package com.traceit.backend.extraction;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedArticle {
    private String title;
    private String author;
    private Instant publishedAt;
    private String content;
    private String leadImageUrl;
}
