package com.flagship.service_entitlement.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.service_entitlement.consumer.event.PaymentSucceededEvent;
import com.flagship.service_entitlement.consumer.event.SessionCancelledEvent;
import com.flagship.service_entitlement.consumer.event.SessionCompletedEvent;
import com.flagship.service_entitlement.observability.CorrelationContext;
import com.flagship.service_entitlement.outbox.AggregateTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka listener for the booking-events topic.
 *
 * Offsets are acknowledged manually, after the event has been handled or
 * recorded as FAILED/SKIPPED. A retryable failure leaves the offset
 * uncommitted so the message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BookingEventConsumer {

    static final String CONSUMER_GROUP = "entitlement-booking-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final BookingEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.bookings:booking-events}",
        groupId = "${spring.kafka.consumer.group-id:entitlement-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Unparseable event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        CorrelationContext.putCorrelationId(envelope.eventId().toString());
        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}", envelope.eventType(), envelope.eventId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}",
                envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.clearAll();
        }
    }

    boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case SessionCompletedEvent.EVENT_TYPE -> {
                SessionCompletedEvent event = deserialize(payload, SessionCompletedEvent.class);
                if (event == null) {
                    yield skipMalformed(envelope);
                }
                yield eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
                    AggregateTypes.STUDENT_ENTITLEMENT, event.studentId(), CONSUMER_GROUP,
                    () -> eventHandler.onSessionCompleted(event));
            }
            case SessionCancelledEvent.EVENT_TYPE -> {
                SessionCancelledEvent event = deserialize(payload, SessionCancelledEvent.class);
                if (event == null) {
                    yield skipMalformed(envelope);
                }
                yield eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
                    AggregateTypes.STUDENT_ENTITLEMENT, event.studentId(), CONSUMER_GROUP,
                    () -> eventHandler.onSessionCancelled(event));
            }
            case PaymentSucceededEvent.EVENT_TYPE -> {
                PaymentSucceededEvent event = deserialize(payload, PaymentSucceededEvent.class);
                if (event == null) {
                    yield skipMalformed(envelope);
                }
                yield eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
                    AggregateTypes.CONTRACT, event.contractId(), CONSUMER_GROUP,
                    () -> eventHandler.onPaymentSucceeded(event));
            }
            default -> {
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), "Unknown", null,
                    CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("eventType")) {
                return null;
            }
            return new EventEnvelope(UUID.fromString(node.get("eventId").asText()), node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private boolean skipMalformed(EventEnvelope envelope) {
        eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), "Unknown", null,
            CONSUMER_GROUP, "Malformed payload");
        return false;
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize {}: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    record EventEnvelope(UUID eventId, String eventType) {
    }
}
