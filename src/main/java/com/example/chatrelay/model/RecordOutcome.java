package com.example.chatrelay.model;

/**
 * Result of a unique insert into the event ledger.
 */
public enum RecordOutcome {
    INSERTED,
    DUPLICATE
}
