package com.flagship.service_entitlement.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of one inbound event handled by a consumer group. At most one exists
 * per (eventId, consumerGroup); its presence makes redelivery a no-op.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,    // not relevant to this consumer
        FAILED      // rejected by a business rule; never retried
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            now, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, String reason, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            now, ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType, String aggregateType,
                                        UUID aggregateId, String consumerGroup, String errorMessage, Instant now) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            now, ProcessingResult.FAILED, errorMessage);
    }
}
