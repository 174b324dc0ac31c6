package com.example.chatrelay.controller;

import com.example.chatrelay.client.FlowiseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Stateless relay for Microsoft Teams: the chatflow keeps the context under the caller's session
 * id, nothing is stored here.
 */
@RestController
public class TeamsWebhookController {

    private static final Logger logger = LoggerFactory.getLogger(TeamsWebhookController.class);

    private final FlowiseClient flowiseClient;

    public TeamsWebhookController(FlowiseClient flowiseClient) {
        this.flowiseClient = flowiseClient;
    }

    @PostMapping("/teams-webhook")
    public Mono<ResponseEntity<Map<String, Object>>> webhook(@RequestBody TeamsMessageRequest request) {
        String text = request.getText();
        String sessionId = request.getSessionId();
        if (text == null || text.isBlank() || sessionId == null || sessionId.isBlank()) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(Map.<String, Object>of("error", "Invalid input. 'text' and 'sessionId' are required.")));
        }

        return Mono.fromCallable(() -> flowiseClient.ask(text, sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(answer -> ResponseEntity.ok(Map.<String, Object>of("message", answer)))
                .onErrorResume(e -> {
                    logger.error("Error handling Teams webhook: {}", e.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.<String, Object>of("error", "Internal Server Error. Please try again later.")));
                });
    }
}
