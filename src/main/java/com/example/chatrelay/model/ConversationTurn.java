package com.example.chatrelay.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One completed question/answer exchange. Never updated after insert.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("msgs")
@CompoundIndex(name = "session_created", def = "{'sessionId': 1, 'createdAt': 1}")
public class ConversationTurn {
    @Id
    private String id;
    private String sessionId;
    private String question;
    private String answer;
    // question.length() + answer.length(), fixed at write time
    private int size;
    private Instant createdAt;
}
