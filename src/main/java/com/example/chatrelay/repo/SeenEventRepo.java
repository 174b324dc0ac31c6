package com.example.chatrelay.repo;

import com.example.chatrelay.model.SeenEvent;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SeenEventRepo extends MongoRepository<SeenEvent, String> {
    boolean existsByEventId(String eventId);
}
