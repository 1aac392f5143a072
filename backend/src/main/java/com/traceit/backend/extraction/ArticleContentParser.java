package com.traceit.backend.extraction;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.traceit.backend.config.TraceitProperties;
import com.traceit.backend.exception.ContentTooSmallException;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

/**
 * Article parsing shared by the fetched and the rendered article extractors.
 * JSON-LD first, then OpenGraph/meta tags, then paragraph text.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ArticleContentParser {

    private static final Set<String> ARTICLE_TYPES = Set.of(
            "article", "newsarticle", "blogposting", "reportagenewsarticle", "socialmediaposting");

    private static final List<String> BODY_CONTAINERS = List.of(
            "[itemprop=articleBody]", "article", "main", "body");

    // 2024-12-16T16:34:07+06:00, 2024-12-16T16:33:30Z, 2024-12-16T16:33:30, 2024-12-16
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),
            Instant::parse,
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());

    private static final String NOISE_SELECTOR = "script, style, noscript, nav, header, footer, aside, form, iframe";

    private final TraceitProperties properties;

    /**
     * Parse raw markup into content, enforcing the markup and body size gates
     */
    public ExtractedContent toContent(String url, String html) {
        int markupBytes = html == null ? 0 : html.getBytes(StandardCharsets.UTF_8).length;
        if (markupBytes < properties.getExtraction().getMinMarkupBytes()) {
            throw new ContentTooSmallException("Markup too small: " + markupBytes + " bytes");
        }

        ParsedArticle article = parse(html, url);
        String content = article.getContent();
        if (content == null || content.length() < properties.getExtraction().getMinBodyChars()) {
            throw new ContentTooSmallException("Article body too small: "
                    + (content == null ? 0 : content.length()) + " characters");
        }

        return ExtractedContent.builder()
                .platform(SourcePlatform.ARTICLE)
                .sourceUrl(url)
                .title(orEmpty(article.getTitle()))
                .author(orEmpty(article.getAuthor()))
                .publishedAt(article.getPublishedAt())
                .bodyText(content)
                .mediaRefs(article.getLeadImageUrl() != null ? List.of(article.getLeadImageUrl()) : List.of())
                .build();
    }

    public ParsedArticle parse(String html, String baseUrl) {
        Document doc = Jsoup.parse(html, baseUrl);
        JsonObject jsonLd = findArticleJsonLd(doc);

        String title = firstNonBlank(
                jsonString(jsonLd, "headline", "name"),
                metaContent(doc, "meta[property=og:title]"),
                doc.title(),
                firstText(doc, "h1"));
        String author = firstNonBlank(
                jsonLd != null ? extractAuthor(jsonLd) : null,
                metaContent(doc, "meta[name=author]"),
                metaContent(doc, "meta[property=article:author]"));
        String published = firstNonBlank(
                jsonString(jsonLd, "datePublished"),
                metaContent(doc, "meta[property=article:published_time]"),
                attr(doc, "time[datetime]", "datetime"));
        String image = firstNonBlank(
                metaContent(doc, "meta[property=og:image]"),
                jsonLd != null ? extractImageUrl(jsonLd) : null);
        String content = firstNonBlank(
                cleanText(jsonString(jsonLd, "articleBody")),
                extractParagraphs(doc));

        return ParsedArticle.builder()
                .title(cleanText(title))
                .author(author)
                .publishedAt(parseDate(published))
                .content(content)
                .leadImageUrl(image)
                .build();
    }

    private JsonObject findArticleJsonLd(Document doc) {
        for (Element script : doc.select("script[type='application/ld+json']")) {
            try {
                JsonElement parsed = JsonParser.parseString(script.data());
                if (parsed.isJsonArray()) {
                    for (JsonElement el : parsed.getAsJsonArray()) {
                        JsonObject article = asArticle(el);
                        if (article != null) return article;
                    }
                } else {
                    JsonObject article = asArticle(parsed);
                    if (article != null) return article;
                    // @graph containers hold the article among other nodes
                    if (parsed.isJsonObject() && parsed.getAsJsonObject().has("@graph")) {
                        for (JsonElement el : parsed.getAsJsonObject().getAsJsonArray("@graph")) {
                            JsonObject graphArticle = asArticle(el);
                            if (graphArticle != null) return graphArticle;
                        }
                    }
                }
            } catch (Exception e) {
                log.debug("Failed to parse JSON-LD: {}", e.getMessage());
            }
        }
        return null;
    }

    private JsonObject asArticle(JsonElement el) {
        if (el == null || !el.isJsonObject()) return null;
        JsonObject obj = el.getAsJsonObject();
        JsonElement type = obj.get("@type");
        if (type == null) return null;
        if (type.isJsonArray()) {
            for (JsonElement t : type.getAsJsonArray()) {
                if (isArticleType(t)) return obj;
            }
            return null;
        }
        return isArticleType(type) ? obj : null;
    }

    private boolean isArticleType(JsonElement type) {
        String name = primitiveString(type);
        return name != null && ARTICLE_TYPES.contains(name.toLowerCase());
    }

    private String extractAuthor(JsonObject obj) {
        if (!obj.has("author")) return null;

        JsonElement authorEl = obj.get("author");
        if (authorEl.isJsonArray() && authorEl.getAsJsonArray().size() > 0) {
            authorEl = authorEl.getAsJsonArray().get(0);
        }
        if (authorEl.isJsonObject()) {
            return primitiveString(authorEl.getAsJsonObject().get("name"));
        }
        return primitiveString(authorEl);
    }

    private String extractImageUrl(JsonObject obj) {
        if (!obj.has("image")) return null;

        JsonElement imageEl = obj.get("image");
        if (imageEl.isJsonArray() && imageEl.getAsJsonArray().size() > 0) {
            imageEl = imageEl.getAsJsonArray().get(0);
        }
        if (imageEl.isJsonObject()) {
            JsonElement url = imageEl.getAsJsonObject().get("url");
            if (url != null && url.isJsonArray() && url.getAsJsonArray().size() > 0) {
                url = url.getAsJsonArray().get(0);
            }
            return primitiveString(url);
        }
        return primitiveString(imageEl);
    }

    // null, JsonNull, objects and arrays all read as missing
    private static String primitiveString(JsonElement el) {
        return el != null && el.isJsonPrimitive() ? el.getAsString() : null;
    }

    private String jsonString(JsonObject obj, String... fields) {
        if (obj == null) return null;
        for (String field : fields) {
            String value = primitiveString(obj.get(field));
            if (value != null) return value;
        }
        return null;
    }

    /**
     * Paragraph text of the first container that has any
     */
    private String extractParagraphs(Document doc) {
        Document cleaned = doc.clone();
        cleaned.select(NOISE_SELECTOR).remove();

        for (String selector : BODY_CONTAINERS) {
            Element container = cleaned.selectFirst(selector);
            if (container == null) continue;

            StringBuilder content = new StringBuilder();
            for (Element paragraph : container.select("p")) {
                String text = paragraph.text().trim();
                if (!text.isEmpty()) {
                    content.append(text).append("\n\n");
                }
            }
            String result = content.toString().trim();
            if (!result.isEmpty()) {
                return result;
            }
        }
        return null;
    }

    private String metaContent(Document doc, String selector) {
        return attr(doc, selector, "content");
    }

    private String attr(Document doc, String selector, String attribute) {
        Element el = doc.selectFirst(selector);
        if (el == null) return null;
        String value = el.attr(attribute);
        return value.isBlank() ? null : value.trim();
    }

    private String firstText(Document doc, String selector) {
        Elements elements = doc.select(selector);
        return elements.isEmpty() ? null : elements.first().text();
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) return null;
        String dateStr = value.trim();

        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(dateStr);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("Could not parse date string {}: {}", dateStr, lastError.getMessage());
        return null;
    }

    private String cleanText(String text) {
        if (text == null) return null;
        return text.replaceAll("<[^>]*>", " ")
                .replace("&nbsp;", " ")
                .replaceAll("[ \\t\\x0B\\f]+", " ")
                .replaceAll("\\s*\\n\\s*", "\n")
                .trim();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
