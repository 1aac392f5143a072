package com.traceit.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.net.URI;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;

@Getter
public enum SourcePlatform {
    REDDIT("reddit", Set.of("reddit.com", "www.reddit.com", "old.reddit.com", "m.reddit.com")),
    YOUTUBE("youtube", Set.of("youtube.com", "www.youtube.com", "m.youtube.com", "youtu.be")),
    ARTICLE("article", Set.of()),
    TEXT("text", Set.of());

    private final String tag;
    private final Set<String> hosts;

    SourcePlatform(String tag, Set<String> hosts) {
        this.tag = tag;
        this.hosts = hosts;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static SourcePlatform fromTag(String tag) {
        if (tag == null) return null;
        for (SourcePlatform platform : values()) {
            if (platform.tag.equalsIgnoreCase(tag)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + tag);
    }

    /**
     * Find the platform whose host list contains the URL's host, or null
     */
    public static SourcePlatform fromUrl(String url) {
        for (SourcePlatform platform : values()) {
            if (platform.matchesUrl(url)) {
                return platform;
            }
        }
        return null;
    }

    /**
     * Check if a URL's host belongs to this platform
     */
    public boolean matchesUrl(String url) {
        String host = hostOf(url);
        return host != null && hosts.contains(host);
    }

    /**
     * Lowercase host of an http(s) URL, or null when the URL cannot be parsed
     */
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean isHttpUrl(String url) {
        return hostOf(url) != null;
    }
}
