package com.example.chatrelay.store;

import com.example.chatrelay.error.StorageException;
import com.example.chatrelay.error.ValidationException;
import com.example.chatrelay.model.ConversationTurn;
import com.example.chatrelay.repo.ConversationTurnRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Component
public class MongoMessageStore implements MessageStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoMessageStore.class);

    private static final Sort OLDEST_FIRST = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final ConversationTurnRepo turnRepo;
    private final Clock clock;

    @Autowired
    public MongoMessageStore(ConversationTurnRepo turnRepo) {
        this(turnRepo, Clock.systemUTC());
    }

    MongoMessageStore(ConversationTurnRepo turnRepo, Clock clock) {
        this.turnRepo = turnRepo;
        this.clock = clock;
    }

    @Override
    public void append(String sessionId, String question, String answer) {
        if (question == null || question.isEmpty() || answer == null || answer.isEmpty()) {
            throw new ValidationException("Question or answer is missing or empty.");
        }

        ConversationTurn turn = ConversationTurn.builder()
                .sessionId(sessionId)
                .question(question)
                .answer(answer)
                .size(question.length() + answer.length())
                .createdAt(Instant.now(clock))
                .build();
        try {
            turnRepo.insert(turn);
        } catch (DataAccessException e) {
            logger.error("Failed to save conversation turn for session {}", sessionId, e);
            throw new StorageException("Failed to save conversation turn", e);
        }
        logger.debug("Saved turn of size {} for session {}", turn.getSize(), sessionId);

        trim(sessionId);
    }

    /**
     * Walks the session newest first and deletes every turn whose running size total, itself
     * included, is over the budget.
     */
    void trim(String sessionId) {
        try {
            List<ConversationTurn> turns = turnRepo.findBySessionId(sessionId, NEWEST_FIRST);
            long totalSize = 0;
            int deleted = 0;
            for (ConversationTurn turn : turns) {
                totalSize += turn.getSize();
                if (totalSize > SIZE_BUDGET) {
                    turnRepo.deleteById(turn.getId());
                    deleted++;
                }
            }
            if (deleted > 0) {
                logger.debug("Discarded {} old turns for session {}", deleted, sessionId);
            }
        } catch (DataAccessException e) {
            logger.error("Failed to trim conversation for session {}", sessionId, e);
            throw new StorageException("Failed to trim conversation", e);
        }
    }

    @Override
    public List<ConversationTurn> history(String sessionId) {
        try {
            return turnRepo.findBySessionId(sessionId, OLDEST_FIRST);
        } catch (DataAccessException e) {
            logger.error("Failed to load history for session {}", sessionId, e);
            throw new StorageException("Failed to load conversation history", e);
        }
    }

    @Override
    public void clear(String sessionId) {
        try {
            long removed = turnRepo.deleteBySessionId(sessionId);
            logger.info("Cleared {} turns for session {}", removed, sessionId);
        } catch (DataAccessException e) {
            logger.error("Failed to clear history for session {}", sessionId, e);
            throw new StorageException("Failed to clear conversation history", e);
        }
    }
}
