package com.flagship.service_entitlement.consumer;

import com.flagship.service_entitlement.exception.InsufficientBalanceException;
import com.flagship.service_entitlement.exception.LockTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Deduplication and failure classification of inbound events. The transaction
 * manager is mocked; commit and rollback are asserted on it.
 */
@ExtendWith(MockitoExtension.class)
class IdempotentEventProcessorTest {

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "SessionCompleted";
    private static final String AGGREGATE_TYPE = "StudentEntitlement";
    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    @Mock
    private ProcessedEventRepository repository;
    @Mock
    private PlatformTransactionManager transactionManager;

    private IdempotentEventProcessor processor;
    private TransactionStatus transactionStatus;
    private UUID eventId;
    private UUID aggregateId;

    @BeforeEach
    void setUp() {
        transactionStatus = mock(TransactionStatus.class);
        lenient().when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        processor = new IdempotentEventProcessor(repository, transactionManager, Clock.fixed(NOW, ZoneOffset.UTC));
        eventId = UUID.randomUUID();
        aggregateId = UUID.randomUUID();
    }

    @Test
    @DisplayName("first delivery runs the handler and records SUCCESS in the same transaction")
    void firstDelivery() {
        AtomicInteger calls = new AtomicInteger();

        boolean processed = processor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(processed);
        assertEquals(1, calls.get());
        ArgumentCaptor<ProcessedEventEntity> saved = ArgumentCaptor.forClass(ProcessedEventEntity.class);
        verify(repository).save(saved.capture());
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, saved.getValue().getProcessingResult());
        assertEquals(eventId, saved.getValue().getEventId());
        assertEquals(NOW, saved.getValue().getProcessedAt());
        verify(transactionManager).commit(transactionStatus);
    }

    @Test
    @DisplayName("a redelivered event does not run the handler")
    void duplicate() {
        when(repository.existsByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP)).thenReturn(true);
        AtomicInteger calls = new AtomicInteger();

        boolean processed = processor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, calls.get());
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("a business rejection rolls back the handler and records FAILED")
    void businessRejection() {
        boolean processed = processor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, () -> {
                throw new InsufficientBalanceException("mentoring_session", 0, 1);
            });

        assertFalse(processed);
        verify(transactionManager).rollback(transactionStatus);
        ArgumentCaptor<ProcessedEventEntity> saved = ArgumentCaptor.forClass(ProcessedEventEntity.class);
        verify(repository).save(saved.capture());
        assertEquals(ProcessedEvent.ProcessingResult.FAILED, saved.getValue().getProcessingResult());
        assertTrue(saved.getValue().getErrorMessage().startsWith("INSUFFICIENT_BALANCE"));
    }

    @Test
    @DisplayName("a retryable failure propagates and records nothing")
    void retryable() {
        LockTimeoutException timeout = new LockTimeoutException("lock timeout", new RuntimeException("timeout"));

        LockTimeoutException thrown = assertThrows(LockTimeoutException.class, () -> processor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, () -> {
                throw timeout;
            }));

        assertSame(timeout, thrown);
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("an unexpected failure propagates and records nothing")
    void unexpected() {
        assertThrows(IllegalStateException.class, () -> processor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, () -> {
                throw new IllegalStateException("boom");
            }));

        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("losing the insert race to another instance counts as a duplicate")
    void concurrentDuplicate() {
        when(repository.existsByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP)).thenReturn(false, true);
        when(repository.save(any())).thenThrow(new DataIntegrityViolationException("uq_processed_events_event_group"));

        boolean processed = processor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, () -> { });

        assertFalse(processed);
        verify(transactionManager).rollback(transactionStatus);
    }

    @Test
    @DisplayName("skipped events are recorded once")
    void skip() {
        processor.skipEvent(eventId, "BookingRescheduled", "Unknown", null, CONSUMER_GROUP, "Unknown event type");

        ArgumentCaptor<ProcessedEventEntity> saved = ArgumentCaptor.forClass(ProcessedEventEntity.class);
        verify(repository).save(saved.capture());
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, saved.getValue().getProcessingResult());
        assertNull(saved.getValue().getAggregateId());
    }
}
