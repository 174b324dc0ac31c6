package com.example.chatrelay.store;

import com.example.chatrelay.model.ConversationTurn;

import java.util.List;

/**
 * Append-only log of question/answer turns, grouped by session and kept under a fixed size
 * budget.
 */
public interface MessageStore {

    /** Total {@code size} a session may retain after trimming. */
    int SIZE_BUDGET = 1024;

    /**
     * Stores a completed turn and trims the session's history back under {@link #SIZE_BUDGET}.
     *
     * @throws com.example.chatrelay.error.ValidationException if question or answer is empty
     */
    void append(String sessionId, String question, String answer);

    /** Turns of the session, oldest first. */
    List<ConversationTurn> history(String sessionId);

    void clear(String sessionId);
}
