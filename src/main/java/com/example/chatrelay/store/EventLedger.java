package com.example.chatrelay.store;

import com.example.chatrelay.model.RecordOutcome;

/**
 * Durable set of inbound event ids used to drop repeated webhook deliveries.
 */
public interface EventLedger {

    /**
     * Inserts the event id. The unique index decides, so of two concurrent calls with the same id
     * exactly one gets {@link RecordOutcome#INSERTED}.
     */
    RecordOutcome recordIfNew(String eventId, String content);

    /** Cheap pre-check. Not atomic with {@link #recordIfNew}. */
    boolean exists(String eventId);

    /**
     * Stores the raw message text on an already recorded event that has none yet.
     *
     * @return whether a record was updated
     */
    boolean attachContent(String eventId, String content);
}
