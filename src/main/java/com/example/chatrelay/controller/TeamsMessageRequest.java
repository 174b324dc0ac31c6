package com.example.chatrelay.controller;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TeamsMessageRequest {
    private String text;
    private String sessionId;
}
