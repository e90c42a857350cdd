package com.flagship.service_entitlement.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event written to the outbox.
 */
public interface DomainEvent {

    /**
     * Unique identifier for this event instance. Consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();

    Instant getOccurredAt();
}
