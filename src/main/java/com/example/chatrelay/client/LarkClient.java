package com.example.chatrelay.client;

import com.example.chatrelay.config.LarkProperties;
import com.example.chatrelay.error.ConfigurationException;
import com.example.chatrelay.error.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Minimal Lark Open API client: tenant access token handling and text replies.
 */
@Service
public class LarkClient {

    private static final Logger logger = LoggerFactory.getLogger(LarkClient.class);

    static final String TOKEN_PATH = "/open-apis/auth/v3/tenant_access_token/internal";
    static final String REPLY_PATH = "/open-apis/im/v1/messages/{messageId}/reply";

    // refresh a little before Lark expires the token
    private static final Duration REFRESH_MARGIN = Duration.ofMinutes(3);

    // missing, invalid or expired access token
    static final Set<Integer> TOKEN_INVALID_CODES = Set.of(99991661, 99991663, 99991668);

    private final WebClient web;
    private final LarkProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private String tenantToken;
    private Instant tokenExpiresAt = Instant.EPOCH;

    @Autowired
    public LarkClient(WebClient.Builder builder, LarkProperties properties, ObjectMapper objectMapper) {
        this(builder, properties, objectMapper, Clock.systemUTC());
    }

    LarkClient(WebClient.Builder builder, LarkProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.web = builder.baseUrl(properties.baseUrl()).build();
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Replies to a message with plain text. Failures are logged and never thrown: by the time a
     * reply is sent the inbound event has already been acknowledged.
     */
    public void reply(String messageId, String text) {
        try {
            String token = tenantToken();
            String content = objectMapper.writeValueAsString(Map.of("text", text));
            JsonNode result = web.post()
                    .uri(REPLY_PATH, messageId)
                    .headers(h -> h.setBearerAuth(token))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("msg_type", "text", "content", content))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            if (result != null && result.path("code").asInt(0) != 0) {
                rejected(messageId, result);
            }
        } catch (WebClientResponseException e) {
            logger.warn("send message to Lark error, messageId={}: {}", messageId, e.getStatusCode());
            JsonNode body = readBody(e);
            if (body != null && body.path("code").asInt(0) != 0) {
                rejected(messageId, body);
            }
        } catch (Exception e) {
            logger.warn("send message to Lark error, messageId={}: {}", messageId, e.getMessage());
        }
    }

    private void rejected(String messageId, JsonNode result) {
        int code = result.path("code").asInt();
        logger.warn("Lark rejected reply to {}: code={} msg={}", messageId, code, result.path("msg").asText(""));
        if (TOKEN_INVALID_CODES.contains(code)) {
            invalidateToken();
        }
    }

    private JsonNode readBody(WebClientResponseException e) {
        try {
            return objectMapper.readTree(e.getResponseBodyAsString());
        } catch (JsonProcessingException parseError) {
            logger.debug("Lark error body is not JSON: {}", parseError.getMessage());
            return null;
        }
    }

    synchronized void invalidateToken() {
        tenantToken = null;
        tokenExpiresAt = Instant.EPOCH;
    }

    synchronized String tenantToken() {
        Instant now = Instant.now(clock);
        if (tenantToken != null && now.isBefore(tokenExpiresAt.minus(REFRESH_MARGIN))) {
            return tenantToken;
        }
        if (!properties.hasCredentials()) {
            throw new ConfigurationException("Lark app id or app secret is not configured");
        }

        JsonNode result = web.post()
                .uri(TOKEN_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("app_id", properties.appId(), "app_secret", properties.appSecret()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block();

        String token = result == null ? "" : result.path("tenant_access_token").asText("");
        if (result == null || result.path("code").asInt(-1) != 0 || token.isBlank()) {
            String msg = result == null ? "empty response" : result.path("msg").asText("");
            throw new UpstreamException("Failed to obtain Lark tenant access token: " + msg);
        }

        tenantToken = token;
        tokenExpiresAt = now.plusSeconds(result.path("expire").asLong(0));
        logger.debug("Refreshed Lark tenant access token, expires at {}", tokenExpiresAt);
        return tenantToken;
    }
}
