package com.example.chatrelay.service;

import com.example.chatrelay.config.LarkProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Self-check of the Lark credentials, answered when the webhook is hit without an event envelope.
 */
@Service
public class DoctorService {

    private static final Logger logger = LoggerFactory.getLogger(DoctorService.class);

    static final String APP_ID_PREFIX = "cli_";

    private final LarkProperties properties;

    public DoctorService(LarkProperties properties) {
        this.properties = properties;
    }

    public Map<String, Object> check() {
        String appId = properties.appId();
        if (appId.isEmpty()) {
            return problem("Here is no Lark APP id, please check & re-Deploy & call again");
        }
        if (!appId.startsWith(APP_ID_PREFIX)) {
            return problem("Your Lark App ID is Wrong, Please Check and call again. Lark APPID must Start with cli");
        }
        if (properties.appSecret().isEmpty()) {
            return problem("Here is no Lark APP Secret, please check & re-Deploy & call again");
        }

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("zh_CN", "✅ 配置成功，接下来你可以在 Lark 应用当中使用机器人来完成你的工作。");
        message.put("en_US", "✅ Configuration is correct, you can use this bot in your Lark App");

        Map<String, Object> verdict = new LinkedHashMap<>();
        verdict.put("code", 0);
        verdict.put("message", message);
        verdict.put("meta", Map.of("LARK_APP_ID", appId));
        return verdict;
    }

    private static Map<String, Object> problem(String text) {
        logger.warn("Configuration problem: {}", text);
        return Map.of("code", 1, "message", Map.of("en_US", text));
    }
}
