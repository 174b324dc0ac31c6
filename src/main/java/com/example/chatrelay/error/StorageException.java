package com.example.chatrelay.error;

/**
 * A database operation failed for a reason other than a duplicate key.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
