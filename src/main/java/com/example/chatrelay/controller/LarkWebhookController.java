package com.example.chatrelay.controller;

import com.example.chatrelay.service.LarkEventHandler;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
public class LarkWebhookController {

    private final LarkEventHandler eventHandler;

    public LarkWebhookController(LarkEventHandler eventHandler) {
        this.eventHandler = eventHandler;
    }

    /**
     * Lark event callback. Storage and outbound calls block, so the handler runs off the event
     * loop.
     */
    @PostMapping("/webhook")
    public Mono<Map<String, Object>> webhook(@RequestBody JsonNode params,
                                             @RequestParam(required = false) String debug) {
        boolean debugRequested = debug != null && !debug.isEmpty();
        return Mono.fromCallable(() -> eventHandler.handle(params, debugRequested))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
