package com.candidateprep.coach.client;

import com.candidateprep.coach.exception.CollaboratorException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Single chat completion against the Groq OpenAI-compatible endpoint. Falls back
 * to a second model when the primary one is out of quota; performs no other retry.
 */
@Component
public class GroqChatClient {

    private static final Logger log = LoggerFactory.getLogger(GroqChatClient.class);

    static final String COLLABORATOR = "groq";

    private final RestClient restClient;
    private final String apiKey;
    private final String apiUrl;
    private final String primaryModel;
    private final String fallbackModel;

    public GroqChatClient(
        @Qualifier("groqRestClient") RestClient restClient,
        @Value("${groq.api.key}") String apiKey,
        @Value("${groq.api.url}") String apiUrl,
        @Value("${groq.model.primary:meta-llama/llama-4-scout-17b-16e-instruct}") String primaryModel,
        @Value("${groq.model.fallback:llama-3.1-8b-instant}") String fallbackModel
    ) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
    }

    public String complete(String systemPrompt, String userContent, double temperature, Integer maxTokens) {
        List<Map<String, String>> messages = List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userContent)
        );
        try {
            return extractContent(postChat(messages, temperature, maxTokens));
        } catch (RestClientResponseException e) {
            throw new CollaboratorException(COLLABORATOR,
                "Completion failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new CollaboratorException(COLLABORATOR, "Completion request failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // HTTP
    // -------------------------------------------------------------------------

    private Map<?, ?> postChat(List<Map<String, String>> messages, double temperature, Integer maxTokens) {
        try {
            return postChatWithModel(primaryModel, messages, temperature, maxTokens);
        } catch (RestClientResponseException e) {
            if (isQuotaError(e)) {
                log.warn("Primary model quota exceeded, falling back to {}", fallbackModel);
                return postChatWithModel(fallbackModel, messages, temperature, maxTokens);
            }
            throw e;
        }
    }

    private Map<?, ?> postChatWithModel(
        String model,
        List<Map<String, String>> messages,
        double temperature,
        Integer maxTokens
    ) {
        var body = new HashMap<String, Object>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", temperature);
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }

        return restClient.post()
            .uri(apiUrl)
            .header("Authorization", "Bearer " + apiKey)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(Map.class);
    }

    private boolean isQuotaError(RestClientResponseException e) {
        int status = e.getStatusCode().value();
        if (status == 429 || status == 402) return true;
        String body = e.getResponseBodyAsString();
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("rate_limit_exceeded")
            || lower.contains("insufficient_quota")
            || lower.contains("quota_exceeded");
    }

    private String extractContent(Map<?, ?> response) {
        if (response == null) throw new CollaboratorException(COLLABORATOR, "Empty completion response");

        if (!(response.get("choices") instanceof List<?> choices) || choices.isEmpty())
            throw new CollaboratorException(COLLABORATOR, "Completion response missing choices");

        if (!(choices.get(0) instanceof Map<?, ?> choice))
            throw new CollaboratorException(COLLABORATOR, "Completion choice is not an object");

        if (!(choice.get("message") instanceof Map<?, ?> message))
            throw new CollaboratorException(COLLABORATOR, "Completion response missing message");

        if (!(message.get("content") instanceof String content))
            throw new CollaboratorException(COLLABORATOR, "Completion content is not a string");

        return content;
    }
}
