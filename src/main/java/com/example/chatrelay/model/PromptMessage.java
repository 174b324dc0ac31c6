package com.example.chatrelay.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptMessage {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;
    private String content;

    public static PromptMessage user(String content) {
        return new PromptMessage(USER, content);
    }

    public static PromptMessage assistant(String content) {
        return new PromptMessage(ASSISTANT, content);
    }
}
