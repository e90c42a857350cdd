package com.flagship.service_entitlement.consumer;

import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs an event handler at most once per (eventId, consumerGroup).
 *
 * The handler and the SUCCESS record commit in one transaction, so a crash
 * between the two is impossible and a redelivered event is skipped.
 *
 * Outcomes:
 * - business rule rejection: the handler's writes roll back, a FAILED record
 *   is written in its own transaction and the event counts as handled
 * - retryable or unexpected failure: nothing is recorded and the exception
 *   propagates so the message is redelivered
 */
@Service
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IdempotentEventProcessor(ProcessedEventRepository repository,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * @return true if the handler ran and committed, false if the event was a
     *         duplicate or was rejected and recorded as FAILED
     */
    public boolean processEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                handler.run();
                repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
                    eventId, eventType, aggregateType, aggregateId, consumerGroup, clock.instant())));
            });
            log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
            return true;

        } catch (EntitlementLedgerException e) {
            if (e.isRetryable()) {
                log.warn("Retryable failure on event {} ({}): {}", eventId, e.getErrorCode(), e.getMessage());
                throw e;
            }
            log.warn("Event {} rejected: type={}, code={}, error={}",
                eventId, eventType, e.getErrorCode(), e.getMessage());
            recordOutcome(ProcessedEvent.failed(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                e.getErrorCode() + ": " + e.getMessage(), clock.instant()));
            return false;

        } catch (DataIntegrityViolationException e) {
            if (isAlreadyProcessed(eventId, consumerGroup)) {
                log.info("Event {} was processed concurrently by consumer group {}", eventId, consumerGroup);
                return false;
            }
            throw e;
        }
    }

    /**
     * Records an event this consumer does not handle so it is never looked at again.
     */
    public void skipEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        recordOutcome(ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            reason, clock.instant()));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void recordOutcome(ProcessedEvent event) {
        try {
            transactionTemplate.executeWithoutResult(status ->
                repository.save(ProcessedEventEntity.fromDomain(event)));
        } catch (DataIntegrityViolationException e) {
            log.info("Outcome of event {} already recorded by consumer group {}",
                event.getEventId(), event.getConsumerGroup());
        }
    }
}
