package com.traceit.backend.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceit.backend.config.TraceitProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Component
@Slf4j
public class PerplexitySearchClient implements SearchClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final TraceitProperties.Search settings;

    public PerplexitySearchClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, TraceitProperties properties) {
        this.settings = properties.getSearch();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(settings.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, "Traceit/1.0.0")
                .build();
        log.info("PerplexitySearchClient initialized: baseUrl={}, enabled={}", settings.getBaseUrl(), isEnabled());
    }

    public boolean isEnabled() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public List<SearchHit> search(String query) {
        if (!isEnabled()) {
            throw new IllegalStateException("Perplexity API key is not configured");
        }

        Map<String, Object> body = Map.of(
                "query", query,
                "max_results", settings.getMaxResults(),
                "include_engagement_metrics", true
        );

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(settings.getPath())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(settings.getTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            log.error("Perplexity API error: status={}, body={}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new IllegalStateException("Failed to perform search", e);
        }

        return toHits(response);
    }

    private List<SearchHit> toHits(JsonNode response) {
        List<SearchHit> hits = new ArrayList<>();
        if (response == null || !response.path("results").isArray()) {
            log.warn("Perplexity response carried no results array");
            return hits;
        }
        for (JsonNode result : response.path("results")) {
            hits.add(objectMapper.convertValue(result, SearchHit.class));
        }
        return hits;
    }
}
