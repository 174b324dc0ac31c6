package com.example.chatrelay.service;

import com.example.chatrelay.client.FlowiseClient;
import com.example.chatrelay.client.LarkClient;
import com.example.chatrelay.error.UpstreamException;
import com.example.chatrelay.error.ValidationException;
import com.example.chatrelay.model.PromptMessage;
import com.example.chatrelay.model.RecordOutcome;
import com.example.chatrelay.store.EventLedger;
import com.example.chatrelay.store.MessageStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Handles one Lark event callback from envelope checks down to the generated reply.
 *
 * <p>Every branch is terminal and answers with a small {@code {code, message?}} map:
 * 0 handled, 1 rejected or duplicate, 2 ignored.
 */
@Service
public class LarkEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(LarkEventHandler.class);

    static final String URL_VERIFICATION = "url_verification";
    static final String MESSAGE_RECEIVE = "im.message.receive_v1";
    static final String CHAT_P2P = "p2p";
    static final String CHAT_GROUP = "group";
    static final String MESSAGE_TEXT = "text";

    static final String UNSUPPORTED_FORMAT_TEXT = "Not support other format question, only text.";
    static final String FAILURE_TEXT = "Sorry, I could not get an answer right now. Please try again later.";

    private static final Pattern MENTION = Pattern.compile("@_user_\\d+");

    private final EventLedger eventLedger;
    private final MessageStore messageStore;
    private final ConversationAssembler assembler;
    private final FlowiseClient flowiseClient;
    private final LarkClient larkClient;
    private final CommandProcessor commandProcessor;
    private final DoctorService doctor;
    private final ObjectMapper objectMapper;

    public LarkEventHandler(EventLedger eventLedger, MessageStore messageStore, ConversationAssembler assembler,
                            FlowiseClient flowiseClient, LarkClient larkClient, CommandProcessor commandProcessor,
                            DoctorService doctor, ObjectMapper objectMapper) {
        this.eventLedger = eventLedger;
        this.messageStore = messageStore;
        this.assembler = assembler;
        this.flowiseClient = flowiseClient;
        this.larkClient = larkClient;
        this.commandProcessor = commandProcessor;
        this.doctor = doctor;
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> handle(JsonNode params, boolean debug) {
        if (isTruthy(params.path("encrypt"))) {
            logger.warn("user enable encrypt key");
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("zh_CN", "你配置了 Encrypt Key，请关闭该功能。");
            message.put("en_US", "You have open Encrypt Key Feature, please close it.");
            return Map.of("code", 1, "message", message);
        }

        if (URL_VERIFICATION.equals(params.path("type").asText())) {
            logger.info("deal url_verification");
            return Map.of("challenge", params.path("challenge").asText(""));
        }

        JsonNode header = params.path("header");
        if (header.isMissingNode() || header.isNull() || debug) {
            logger.info("enter doctor");
            return doctor.check();
        }

        if (!MESSAGE_RECEIVE.equals(header.path("event_type").asText())) {
            logger.debug("Ignoring event type {}", header.path("event_type").asText());
            return Map.of("code", 2);
        }

        return handleMessage(header, params.path("event"));
    }

    private Map<String, Object> handleMessage(JsonNode header, JsonNode event) {
        String eventId = requireText(header, "event_id");
        JsonNode message = event.path("message");
        String messageId = requireText(message, "message_id");
        String chatId = message.path("chat_id").asText("");
        String senderId = event.path("sender").path("sender_id").path("user_id").asText("");
        String sessionId = chatId + senderId;

        if (eventLedger.exists(eventId)) {
            logger.info("skip repeat event {}", eventId);
            return Map.of("code", 1);
        }
        if (eventLedger.recordIfNew(eventId, null) == RecordOutcome.DUPLICATE) {
            return Map.of("code", 1, "message", "Duplicate event ID");
        }

        String chatType = message.path("chat_type").asText();
        if (!CHAT_P2P.equals(chatType) && !CHAT_GROUP.equals(chatType)) {
            logger.info("Ignoring chat type {} for event {}", chatType, eventId);
            return Map.of("code", 2);
        }

        if (!MESSAGE_TEXT.equals(message.path("message_type").asText())) {
            larkClient.reply(messageId, UNSUPPORTED_FORMAT_TEXT);
            logger.info("skip and reply not support");
            return Map.of("code", 0);
        }

        String text = parseText(message.path("content").asText(""));
        return handleReply(text, sessionId, messageId, eventId);
    }

    private Map<String, Object> handleReply(String text, String sessionId, String messageId, String eventId) {
        String question = MENTION.matcher(text).replaceAll("").trim();
        logger.debug("question: {}", question);
        if (question.isEmpty()) {
            return Map.of("code", 0);
        }
        if (CommandProcessor.isCommand(question)) {
            return commandProcessor.process(question, sessionId, messageId);
        }

        List<PromptMessage> prompt = assembler.buildPrompt(sessionId, question);
        String answer;
        try {
            answer = flowiseClient.ask(prompt);
        } catch (UpstreamException e) {
            larkClient.reply(messageId, FAILURE_TEXT);
            throw e;
        }

        messageStore.append(sessionId, question, answer);
        larkClient.reply(messageId, answer);

        // the reply has already gone out; content is kept only if the ledger still accepts it
        if (!eventLedger.attachContent(eventId, text)) {
            logger.debug("Content for event {} was not stored", eventId);
        }
        return Map.of("code", 0);
    }

    private String parseText(String content) {
        try {
            return objectMapper.readTree(content).path("text").asText("");
        } catch (JsonProcessingException e) {
            throw new ValidationException("Message content is not valid JSON", e);
        }
    }

    private static String requireText(JsonNode node, String field) {
        String value = node.path(field).asText("");
        if (value.isBlank()) {
            throw new ValidationException("Event is missing " + field);
        }
        return value;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isBoolean() || node.isNumber()) {
            return node.asBoolean();
        }
        return true;
    }
}
