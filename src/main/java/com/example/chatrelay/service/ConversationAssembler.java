package com.example.chatrelay.service;

import com.example.chatrelay.model.ConversationTurn;
import com.example.chatrelay.model.PromptMessage;
import com.example.chatrelay.store.MessageStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ConversationAssembler {

    private final MessageStore messageStore;

    public ConversationAssembler(MessageStore messageStore) {
        this.messageStore = messageStore;
    }

    /**
     * Replays the stored turns of a session as user/assistant pairs and appends the new question.
     * Whatever survived trimming is sent as is.
     */
    public List<PromptMessage> buildPrompt(String sessionId, String newQuestion) {
        List<ConversationTurn> history = messageStore.history(sessionId);
        List<PromptMessage> prompt = new ArrayList<>(history.size() * 2 + 1);
        for (ConversationTurn turn : history) {
            prompt.add(PromptMessage.user(turn.getQuestion()));
            prompt.add(PromptMessage.assistant(turn.getAnswer()));
        }
        prompt.add(PromptMessage.user(newQuestion));
        return prompt;
    }
}
