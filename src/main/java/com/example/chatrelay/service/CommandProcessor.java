package com.example.chatrelay.service;

import com.example.chatrelay.client.LarkClient;
import com.example.chatrelay.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Slash commands typed into the chat. Unknown commands get the help text.
 */
@Service
public class CommandProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    public static final String PREFIX = "/";
    static final String HELP = "/help";
    static final String CLEAR = "/clear";

    static final String HELP_TEXT = "Lark GPT manpages\n\n"
            + "Usage:\n"
            + "    /clear    remove conversation history for get a new, clean, bot context.\n"
            + "    /help     get more help message\n";
    static final String CLEARED_TEXT = "✅ All history removed";

    private final MessageStore messageStore;
    private final LarkClient larkClient;

    public CommandProcessor(MessageStore messageStore, LarkClient larkClient) {
        this.messageStore = messageStore;
        this.larkClient = larkClient;
    }

    public static boolean isCommand(String text) {
        return text != null && text.startsWith(PREFIX);
    }

    public Map<String, Object> process(String action, String sessionId, String messageId) {
        logger.info("Processing command {} for session {}", action, sessionId);
        switch (action) {
            case CLEAR:
                messageStore.clear(sessionId);
                larkClient.reply(messageId, CLEARED_TEXT);
                break;
            case HELP:
            default:
                larkClient.reply(messageId, HELP_TEXT);
                break;
        }
        return Map.of("code", 0);
    }
}
