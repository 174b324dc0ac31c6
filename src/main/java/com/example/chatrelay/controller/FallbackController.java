package com.example.chatrelay.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Catch-all for routes no other controller maps; more specific mappings always win.
 */
@RestController
public class FallbackController {

    @RequestMapping("/**")
    public ResponseEntity<Map<String, Object>> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Not Found"));
    }
}
