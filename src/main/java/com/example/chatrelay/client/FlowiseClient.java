package com.example.chatrelay.client;

import com.example.chatrelay.error.UpstreamException;
import com.example.chatrelay.model.PromptMessage;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * Client for a Flowise chatflow prediction endpoint. Callers run on blocking-friendly threads, so
 * each call waits for the response.
 */
@Service
public class FlowiseClient {

    private static final Logger logger = LoggerFactory.getLogger(FlowiseClient.class);

    static final String DEFAULT_SESSION_ID = "default-session";

    private final WebClient web;
    private final String apiUrl;

    public FlowiseClient(WebClient.Builder builder, @Value("${app.flowise.api-url:}") String apiUrl) {
        this.web = builder.build();
        this.apiUrl = apiUrl == null ? "" : apiUrl.trim();
    }

    /**
     * Sends the whole assembled conversation; history is kept on this side.
     */
    public String ask(List<PromptMessage> prompt) {
        return query(Map.of("question", prompt));
    }

    /**
     * Sends a single question and lets the chatflow track context under {@code sessionId}.
     */
    public String ask(String question, String sessionId) {
        String session = sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId;
        return query(Map.of(
                "question", question,
                "overrideConfig", Map.of("sessionId", session)
        ));
    }

    public String query(Map<String, Object> payload) {
        if (apiUrl.isEmpty()) {
            throw new UpstreamException("Flowise API URL is not configured");
        }

        JsonNode result;
        try {
            result = web.post()
                    .uri(apiUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().is2xxSuccessful()) {
                // a 2xx body that could not be decoded as JSON
                logger.error("Invalid response from Flowise API: {}", e.getResponseBodyAsString());
                throw new UpstreamException("Invalid response from Flowise API", e);
            }
            logger.error("Flowise API returned an error: {} {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new UpstreamException("Flowise API returned an error: " + e.getStatusCode(), e);
        } catch (WebClientException | CodecException e) {
            logger.error("Error querying Flowise API: {}", e.getMessage());
            throw new UpstreamException("Error querying Flowise API", e);
        }

        JsonNode text = result == null ? null : result.get("text");
        if (text == null || !text.isTextual() || text.asText().isBlank()) {
            logger.error("Invalid response from Flowise API: {}", result);
            throw new UpstreamException("Invalid response from Flowise API");
        }
        return text.asText();
    }
}
