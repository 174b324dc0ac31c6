package com.example.chatrelay.error;

/**
 * The downstream query endpoint was unreachable or answered with an unusable response.
 */
public class UpstreamException extends RuntimeException {
    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
