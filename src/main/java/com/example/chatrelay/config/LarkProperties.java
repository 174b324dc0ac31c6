package com.example.chatrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.lark")
public record LarkProperties(String appId, String appSecret, String baseUrl) {

    public static final String DEFAULT_BASE_URL = "https://open.larksuite.com";

    public LarkProperties {
        appId = appId == null ? "" : appId.trim();
        appSecret = appSecret == null ? "" : appSecret.trim();
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    public boolean hasCredentials() {
        return !appId.isEmpty() && !appSecret.isEmpty();
    }
}
