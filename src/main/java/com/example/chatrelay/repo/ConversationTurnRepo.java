package com.example.chatrelay.repo;

import com.example.chatrelay.model.ConversationTurn;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ConversationTurnRepo extends MongoRepository<ConversationTurn, String> {
    List<ConversationTurn> findBySessionId(String sessionId, Sort sort);
    long deleteBySessionId(String sessionId);
}
