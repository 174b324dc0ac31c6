package com.example.chatrelay.store;

import com.example.chatrelay.error.StorageException;
import com.example.chatrelay.kv.KvClient;
import com.example.chatrelay.model.RecordOutcome;
import com.example.chatrelay.model.SeenEvent;
import com.example.chatrelay.repo.SeenEventRepo;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MongoEventLedger implements EventLedger {

    private static final Logger logger = LoggerFactory.getLogger(MongoEventLedger.class);

    static final String CACHE_PREFIX = "seen-event:";

    private final SeenEventRepo seenEventRepo;
    private final MongoTemplate mongo;
    private final KvClient kvClient;

    @Value("${app.dedup.cache.enabled:false}")
    private boolean cacheEnabled;

    @Value("${app.dedup.cache.ttl:PT24H}")
    private Duration cacheTtl;

    public MongoEventLedger(SeenEventRepo seenEventRepo, MongoTemplate mongo, KvClient kvClient) {
        this.seenEventRepo = seenEventRepo;
        this.mongo = mongo;
        this.kvClient = kvClient;
    }

    @Override
    public RecordOutcome recordIfNew(String eventId, String content) {
        try {
            seenEventRepo.insert(SeenEvent.builder().eventId(eventId).content(content).build());
        } catch (DuplicateKeyException e) {
            logger.info("Duplicate event ID: {}", eventId);
            return RecordOutcome.DUPLICATE;
        } catch (DataAccessException e) {
            logger.error("Failed to record event {}", eventId, e);
            throw new StorageException("Failed to record event " + eventId, e);
        }
        remember(eventId);
        return RecordOutcome.INSERTED;
    }

    @Override
    public boolean exists(String eventId) {
        if (cacheEnabled && cached(eventId)) {
            return true;
        }
        try {
            return seenEventRepo.existsByEventId(eventId);
        } catch (DataAccessException e) {
            logger.error("Failed to look up event {}", eventId, e);
            throw new StorageException("Failed to look up event " + eventId, e);
        }
    }

    @Override
    public boolean attachContent(String eventId, String content) {
        Query query = new Query(Criteria.where("eventId").is(eventId).and("content").is(null));
        try {
            UpdateResult result = mongo.updateFirst(query, Update.update("content", content), SeenEvent.class);
            return result.getModifiedCount() > 0;
        } catch (DuplicateKeyException e) {
            logger.info("Duplicate event ID while saving content: {}", eventId);
            return false;
        } catch (DataAccessException e) {
            logger.error("Failed to save content for event {}", eventId, e);
            throw new StorageException("Failed to save content for event " + eventId, e);
        }
    }

    private boolean cached(String eventId) {
        try {
            return kvClient.get(CACHE_PREFIX + eventId).isPresent();
        } catch (Exception e) {
            logger.warn("Seen-event cache lookup failed for {}: {}", eventId, e.getMessage());
            return false;
        }
    }

    private void remember(String eventId) {
        if (!cacheEnabled) {
            return;
        }
        try {
            kvClient.set(CACHE_PREFIX + eventId, "1", cacheTtl);
        } catch (Exception e) {
            logger.warn("Seen-event cache write failed for {}: {}", eventId, e.getMessage());
        }
    }
}
