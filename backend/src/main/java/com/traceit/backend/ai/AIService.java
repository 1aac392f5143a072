package com.traceit.backend.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * Gateway to the reasoning and embedding models
 */
@Service
@Slf4j
public class AIService {

    private final ChatClient chatClient;
    private final EmbeddingModel embeddingModel;

    public AIService(ChatClient.Builder builder, EmbeddingModel embeddingModel) {
        this.chatClient = builder.build();
        this.embeddingModel = embeddingModel;
    }

    /**
     * Single system + user prompt round trip, returns the raw text content
     */
    public String complete(String systemPrompt, String userPrompt) {
        log.debug("Calling reasoning model: prompt_length={}", userPrompt.length());
        return chatClient
                .prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
    }

    public float[] embed(String text) {
        return embeddingModel.embed(text);
    }

    /**
     * Cut the JSON object or array out of a model response that may carry prose or code fences
     */
    public static String extractJson(String response) {
        if (response == null) return "{}";

        int objectStart = response.indexOf('{');
        int arrayStart = response.indexOf('[');
        boolean isArray = arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart);

        int start = isArray ? arrayStart : objectStart;
        int end = isArray ? response.lastIndexOf(']') : response.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return response.substring(start, end + 1);
        }
        return response.trim();
    }

    /**
     * Truncate content to fit within token limits
     */
    public static String truncateContent(String content, int maxChars) {
        if (content == null || content.length() <= maxChars) {
            return content;
        }

        // Try to truncate at sentence boundary
        String truncated = content.substring(0, maxChars);
        int lastSentence = Math.max(
                truncated.lastIndexOf('.'),
                Math.max(truncated.lastIndexOf('!'), truncated.lastIndexOf('?'))
        );

        if (lastSentence > maxChars / 2) {
            return truncated.substring(0, lastSentence + 1);
        }
        return truncated + "...";
    }
}
