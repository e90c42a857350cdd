package com.flagship.service_entitlement.consumer;

import com.flagship.service_entitlement.consumer.event.PaymentSucceededEvent;
import com.flagship.service_entitlement.consumer.event.SessionCompletedEvent;
import com.flagship.service_entitlement.contract.Contract;
import com.flagship.service_entitlement.contract.ContractStatus;
import com.flagship.service_entitlement.entitlement.BalanceService;
import com.flagship.service_entitlement.hold.HoldService;
import com.flagship.service_entitlement.ledger.LedgerService;
import com.flagship.service_entitlement.outbox.AggregateTypes;
import com.flagship.service_entitlement.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Inbound booking and payment events applied through the deduplicating
 * processor against a real database.
 */
class BookingEventProcessingIntegrationTest extends PostgresIntegrationTest {

    private static final String GROUP = BookingEventConsumer.CONSUMER_GROUP;
    private static final String SERVICE_TYPE = "group_class";

    @Autowired
    private IdempotentEventProcessor eventProcessor;
    @Autowired
    private ProcessedEventRepository processedEventRepository;
    @Autowired
    private LedgerService ledgerService;
    @Autowired
    private HoldService holdService;
    @Autowired
    private BalanceService balanceService;

    private BookingEventHandler handler;
    private UUID studentId;
    private UUID productId;

    @BeforeEach
    void setUp() {
        handler = new BookingEventHandler(ledgerService, holdService, contractService);
        studentId = UUID.randomUUID();
        productId = createProduct(Map.of(SERVICE_TYPE, 2));
    }

    private boolean deliver(SessionCompletedEvent event) {
        return eventProcessor.processEvent(event.eventId(), SessionCompletedEvent.EVENT_TYPE,
            AggregateTypes.STUDENT_ENTITLEMENT, event.studentId(), GROUP,
            () -> handler.onSessionCompleted(event));
    }

    private int ledgerRows() {
        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM service_ledgers WHERE student_id = ?", Integer.class, studentId);
        return rows == null ? 0 : rows;
    }

    @Test
    @DisplayName("a redelivered SessionCompleted consumes only once")
    void duplicateDelivery() {
        Contract contract = createActiveContract(studentId, productId);
        SessionCompletedEvent event = new SessionCompletedEvent(UUID.randomUUID(), UUID.randomUUID(), studentId,
            SERVICE_TYPE, contract.getId(), null, "class-scheduler", null);

        assertTrue(deliver(event));
        assertFalse(deliver(event));

        assertEquals(1, ledgerRows());
        assertEquals(1, balanceService.getBalance(studentId, SERVICE_TYPE).getAvailableQuantity());
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, processedEventRepository
            .findByEventIdAndConsumerGroup(event.eventId(), GROUP).orElseThrow().getProcessingResult());
    }

    @Test
    @DisplayName("a rejected event is recorded as FAILED and leaves no partial writes")
    void rejectedEventRollsBack() {
        Contract contract = createActiveContract(studentId, productId);
        contractService.transitionStatus(contract.getId(), ContractStatus.SUSPENDED, "chargeback", "ops");
        SessionCompletedEvent event = new SessionCompletedEvent(UUID.randomUUID(), UUID.randomUUID(), studentId,
            SERVICE_TYPE, contract.getId(), null, "class-scheduler", null);

        assertFalse(deliver(event));

        assertEquals(0, ledgerRows());
        ProcessedEventEntity recorded = processedEventRepository
            .findByEventIdAndConsumerGroup(event.eventId(), GROUP).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.FAILED, recorded.getProcessingResult());
        assertTrue(recorded.getErrorMessage().startsWith("CONTRACT_NOT_ACTIVE"));
        assertFalse(deliver(event));
    }

    @Test
    @DisplayName("PaymentSucceeded activates a signed contract and is a no-op afterwards")
    void paymentActivatesContract() {
        Contract draft = createDraft(studentId, productId);
        contractService.transitionStatus(draft.getId(), ContractStatus.SIGNED, null, "advisor");
        PaymentSucceededEvent first = new PaymentSucceededEvent(UUID.randomUUID(), draft.getId(), UUID.randomUUID());
        PaymentSucceededEvent second = new PaymentSucceededEvent(UUID.randomUUID(), draft.getId(), UUID.randomUUID());

        assertTrue(eventProcessor.processEvent(first.eventId(), PaymentSucceededEvent.EVENT_TYPE,
            AggregateTypes.CONTRACT, draft.getId(), GROUP, () -> handler.onPaymentSucceeded(first)));
        assertTrue(eventProcessor.processEvent(second.eventId(), PaymentSucceededEvent.EVENT_TYPE,
            AggregateTypes.CONTRACT, draft.getId(), GROUP, () -> handler.onPaymentSucceeded(second)));

        assertEquals(ContractStatus.ACTIVE, contractService.getContract(draft.getId()).getStatus());
        assertEquals(2, balanceService.getBalance(studentId, SERVICE_TYPE).getTotalQuantity());
    }
}
