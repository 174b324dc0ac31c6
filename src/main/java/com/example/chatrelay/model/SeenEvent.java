package com.example.chatrelay.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("events")
public class SeenEvent {
    @Id
    private String id;
    @Indexed(unique = true)
    private String eventId;
    private String content;
}
