package com.traceit.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "traceit")
@Data
public class TraceitProperties {

    private Quota quota = new Quota();
    private Extraction extraction = new Extraction();
    private Claims claims = new Claims();
    private Ranking ranking = new Ranking();
    private Search search = new Search();
    private Lineage lineage = new Lineage();
    private Pipeline pipeline = new Pipeline();
    private Webdriver webdriver = new Webdriver();

    @Data
    public static class Quota {
        private int dailyLimit = 10;
        // Daily window resets at midnight in this zone
        private String zone = "UTC";
    }

    @Data
    public static class Extraction {
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/140.0.0.0 Safari/537.36";
        private int timeoutSeconds = 15;
        private int minMarkupBytes = 1024;
        private int minBodyChars = 100;
        private String redditUserAgent = "Traceit/1.0.0";
        private String ytdlpBinary = "yt-dlp";
        private int ytdlpTimeoutSeconds = 30;
    }

    @Data
    public static class Claims {
        private int maxClaims = 5;
        private int maxBlobChars = 12000;
    }

    @Data
    public static class Ranking {
        private RankingFallback fallback = RankingFallback.EXTRACTION_ORDER;
    }

    @Data
    public static class Search {
        private String baseUrl = "https://api.perplexity.ai";
        private String path = "/sonar";
        private String apiKey;
        private int maxResults = 4;
        private int timeoutSeconds = 20;
    }

    @Data
    public static class Lineage {
        private String keyPrefix = "claim:";
        private int ttlDays = 90;
    }

    @Data
    public static class Pipeline {
        private int timeoutSeconds = 120;
    }

    @Data
    public static class Webdriver {
        // chrome | firefox
        private String type = "chrome";
        private boolean headless = true;
        private int timeoutSeconds = 20;
        private int windowWidth = 1280;
        private int windowHeight = 800;
    }

    /**
     * What the ranking stage does when the score response cannot be parsed.
     */
    public enum RankingFallback {
        /** First claim in extraction order becomes primary. */
        EXTRACTION_ORDER,
        /** The run ends with an extraction failure. */
        FAIL
    }
}
