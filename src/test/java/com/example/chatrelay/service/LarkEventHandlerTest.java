package com.example.chatrelay.service;

import com.example.chatrelay.client.FlowiseClient;
import com.example.chatrelay.client.LarkClient;
import com.example.chatrelay.error.UpstreamException;
import com.example.chatrelay.error.ValidationException;
import com.example.chatrelay.model.PromptMessage;
import com.example.chatrelay.model.RecordOutcome;
import com.example.chatrelay.store.EventLedger;
import com.example.chatrelay.store.MessageStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LarkEventHandlerTest {

    private static final String SESSION = "oc_chat" + "ou_user";

    @Mock
    private EventLedger eventLedger;

    @Mock
    private MessageStore messageStore;

    @Mock
    private ConversationAssembler assembler;

    @Mock
    private FlowiseClient flowiseClient;

    @Mock
    private LarkClient larkClient;

    @Mock
    private DoctorService doctor;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LarkEventHandler handler;

    @BeforeEach
    void setUp() {
        CommandProcessor commandProcessor = new CommandProcessor(messageStore, larkClient);
        handler = new LarkEventHandler(eventLedger, messageStore, assembler, flowiseClient, larkClient,
                commandProcessor, doctor, objectMapper);
    }

    @Test
    void testEncryptedPayloadIsRejected() {
        ObjectNode params = objectMapper.createObjectNode().put("encrypt", "ciphertext");

        Map<String, Object> result = handler.handle(params, false);

        assertEquals(1, result.get("code"));
        assertNotNull(result.get("message"));
        verifyNoInteractions(eventLedger, doctor, larkClient);
    }

    @Test
    void testUrlVerificationEchoesChallenge() {
        ObjectNode params = objectMapper.createObjectNode()
                .put("type", "url_verification")
                .put("challenge", "abc123");

        Map<String, Object> result = handler.handle(params, false);

        assertEquals(Map.of("challenge", "abc123"), result);
    }

    @Test
    void testMissingHeaderRunsDoctor() {
        Map<String, Object> verdict = Map.of("code", 0);
        when(doctor.check()).thenReturn(verdict);

        Map<String, Object> result = handler.handle(objectMapper.createObjectNode(), false);

        assertSame(verdict, result);
        verifyNoInteractions(eventLedger);
    }

    @Test
    void testDebugFlagRunsDoctorEvenWithHeader() {
        Map<String, Object> verdict = Map.of("code", 1);
        when(doctor.check()).thenReturn(verdict);

        Map<String, Object> result = handler.handle(textEvent("evt-1", "p2p", "hello"), true);

        assertSame(verdict, result);
        verifyNoInteractions(eventLedger);
    }

    @Test
    void testOtherEventTypesAreAcknowledged() {
        ObjectNode params = textEvent("evt-1", "p2p", "hello");
        ((ObjectNode) params.get("header")).put("event_type", "im.chat.member.bot.added_v1");

        Map<String, Object> result = handler.handle(params, false);

        assertEquals(Map.of("code", 2), result);
        verifyNoInteractions(eventLedger);
    }

    @Test
    void testRepeatedEventIsSkipped() {
        when(eventLedger.exists("evt-1")).thenReturn(true);

        Map<String, Object> result = handler.handle(textEvent("evt-1", "p2p", "hello"), false);

        assertEquals(Map.of("code", 1), result);
        verify(eventLedger, never()).recordIfNew(anyString(), any());
        verifyNoInteractions(flowiseClient, larkClient);
    }

    @Test
    void testConcurrentDeliveriesOnlyOneReplies() {
        // Given: both deliveries pass the pre-check, the unique insert decides
        when(eventLedger.exists("evt-1")).thenReturn(false);
        when(eventLedger.recordIfNew("evt-1", null))
                .thenReturn(RecordOutcome.INSERTED)
                .thenReturn(RecordOutcome.DUPLICATE);
        when(assembler.buildPrompt(SESSION, "hello")).thenReturn(List.of(PromptMessage.user("hello")));
        when(flowiseClient.ask(anyList())).thenReturn("hi there");
        when(eventLedger.attachContent(anyString(), anyString())).thenReturn(true);

        // When
        Map<String, Object> first = handler.handle(textEvent("evt-1", "p2p", "hello"), false);
        Map<String, Object> second = handler.handle(textEvent("evt-1", "p2p", "hello"), false);

        // Then
        assertEquals(Map.of("code", 0), first);
        assertEquals(Map.of("code", 1, "message", "Duplicate event ID"), second);
        verify(flowiseClient, times(1)).ask(anyList());
        verify(larkClient, times(1)).reply("om_evt-1", "hi there");
    }

    @Test
    void testUnsupportedChatTypeIsIgnored() {
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);

        Map<String, Object> result = handler.handle(textEvent("evt-1", "topic", "hello"), false);

        assertEquals(Map.of("code", 2), result);
        verifyNoInteractions(flowiseClient, larkClient);
    }

    @Test
    void testNonTextMessageGetsUnsupportedFormatReply() {
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);
        ObjectNode params = textEvent("evt-1", "group", "hello");
        ((ObjectNode) params.path("event").path("message")).put("message_type", "image");

        Map<String, Object> result = handler.handle(params, false);

        assertEquals(Map.of("code", 0), result);
        verify(larkClient).reply("om_evt-1", LarkEventHandler.UNSUPPORTED_FORMAT_TEXT);
        verifyNoInteractions(flowiseClient);
    }

    @Test
    void testClearCommandEmptiesSessionAndConfirms() {
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);

        Map<String, Object> result = handler.handle(textEvent("evt-1", "p2p", "/clear"), false);

        assertEquals(Map.of("code", 0), result);
        verify(messageStore).clear(SESSION);
        verify(larkClient).reply("om_evt-1", CommandProcessor.CLEARED_TEXT);
        verifyNoInteractions(flowiseClient, assembler);
    }

    @Test
    void testMentionIsStrippedBeforeCommandMatch() {
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);

        handler.handle(textEvent("evt-1", "group", "@_user_1 /help"), false);

        verify(larkClient).reply("om_evt-1", CommandProcessor.HELP_TEXT);
        verifyNoInteractions(flowiseClient);
    }

    @Test
    void testConversationalTurnRunsInOrder() {
        // Given
        List<PromptMessage> prompt = List.of(PromptMessage.user("what is up"));
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);
        when(assembler.buildPrompt(SESSION, "what is up")).thenReturn(prompt);
        when(flowiseClient.ask(prompt)).thenReturn("not much");
        when(eventLedger.attachContent("evt-1", "@_user_1 what is up")).thenReturn(true);

        // When
        Map<String, Object> result = handler.handle(textEvent("evt-1", "group", "@_user_1 what is up"), false);

        // Then
        assertEquals(Map.of("code", 0), result);
        InOrder inOrder = inOrder(flowiseClient, messageStore, larkClient, eventLedger);
        inOrder.verify(flowiseClient).ask(prompt);
        inOrder.verify(messageStore).append(SESSION, "what is up", "not much");
        inOrder.verify(larkClient).reply("om_evt-1", "not much");
        inOrder.verify(eventLedger).attachContent("evt-1", "@_user_1 what is up");
    }

    @Test
    void testContentNotAttachedIsNotAFailure() {
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);
        when(assembler.buildPrompt(SESSION, "hello")).thenReturn(List.of(PromptMessage.user("hello")));
        when(flowiseClient.ask(anyList())).thenReturn("hi");
        when(eventLedger.attachContent("evt-1", "hello")).thenReturn(false);

        Map<String, Object> result = handler.handle(textEvent("evt-1", "p2p", "hello"), false);

        assertEquals(Map.of("code", 0), result);
    }

    @Test
    void testUpstreamFailureApologisesAndPropagates() {
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);
        when(assembler.buildPrompt(SESSION, "hello")).thenReturn(List.of(PromptMessage.user("hello")));
        when(flowiseClient.ask(anyList())).thenThrow(new UpstreamException("Invalid response from Flowise API"));

        assertThrows(UpstreamException.class,
                () -> handler.handle(textEvent("evt-1", "p2p", "hello"), false));

        verify(larkClient).reply("om_evt-1", LarkEventHandler.FAILURE_TEXT);
        verify(messageStore, never()).append(anyString(), anyString(), anyString());
        verify(eventLedger, never()).attachContent(anyString(), anyString());
    }

    @Test
    void testMalformedContentIsRejected() {
        when(eventLedger.recordIfNew("evt-1", null)).thenReturn(RecordOutcome.INSERTED);
        ObjectNode params = textEvent("evt-1", "p2p", "hello");
        ((ObjectNode) params.path("event").path("message")).put("content", "{not json");

        assertThrows(ValidationException.class, () -> handler.handle(params, false));
    }

    @Test
    void testMissingEventIdIsRejected() {
        ObjectNode params = textEvent("evt-1", "p2p", "hello");
        ((ObjectNode) params.get("header")).remove("event_id");

        assertThrows(ValidationException.class, () -> handler.handle(params, false));
        verifyNoInteractions(eventLedger);
    }

    private ObjectNode textEvent(String eventId, String chatType, String text) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("schema", "2.0");
        params.putObject("header")
                .put("event_id", eventId)
                .put("event_type", "im.message.receive_v1");
        ObjectNode event = params.putObject("event");
        event.putObject("sender").putObject("sender_id").put("user_id", "ou_user");
        event.putObject("message")
                .put("message_id", "om_" + eventId)
                .put("chat_id", "oc_chat")
                .put("chat_type", chatType)
                .put("message_type", "text")
                .put("content", objectMapper.createObjectNode().put("text", text).toString());
        return params;
    }
}
