package com.flagship.service_entitlement.consumer;

import com.flagship.service_entitlement.consumer.event.PaymentSucceededEvent;
import com.flagship.service_entitlement.consumer.event.SessionCancelledEvent;
import com.flagship.service_entitlement.consumer.event.SessionCompletedEvent;
import com.flagship.service_entitlement.contract.Contract;
import com.flagship.service_entitlement.contract.ContractService;
import com.flagship.service_entitlement.contract.ContractStatus;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.hold.HoldService;
import com.flagship.service_entitlement.ledger.ConsumeCommand;
import com.flagship.service_entitlement.ledger.LedgerEntry;
import com.flagship.service_entitlement.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Applies upstream booking and payment events to the ledger.
 *
 * Handlers run inside {@link IdempotentEventProcessor}'s transaction, so they
 * need no deduplication of their own.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BookingEventHandler {

    static final String BOOKING_SERVICE_ACTOR = "booking-service";
    static final String PAYMENT_SERVICE_ACTOR = "payment-service";
    static final String SESSION_CANCELLED_REASON = "session_cancelled";
    static final String PAYMENT_SUCCEEDED_REASON = "payment_succeeded";

    private final LedgerService ledgerService;
    private final HoldService holdService;
    private final ContractService contractService;

    public void onSessionCompleted(SessionCompletedEvent event) {
        log.info("Handling SessionCompleted: sessionId={}, studentId={}, serviceType={}, holdId={}",
            event.sessionId(), event.studentId(), event.serviceType(), event.holdId());

        if (event.sessionId() == null) {
            throw new ValidationException("SessionCompleted without sessionId");
        }
        List<LedgerEntry> entries = ledgerService.recordConsumption(new ConsumeCommand(
            event.studentId(),
            event.serviceType(),
            1,
            event.sessionId(),
            event.bookingSource(),
            event.holdId(),
            event.contractId(),
            actorOrDefault(event.createdBy(), BOOKING_SERVICE_ACTOR)
        ));
        log.debug("Session {} consumed across {} entitlement row(s)", event.sessionId(), entries.size());
    }

    public void onSessionCancelled(SessionCancelledEvent event) {
        log.info("Handling SessionCancelled: sessionId={}, holdId={}", event.sessionId(), event.holdId());

        if (event.holdId() == null) {
            throw new ValidationException("SessionCancelled without holdId");
        }
        holdService.cancelHold(event.holdId(),
            actorOrDefault(event.reason(), SESSION_CANCELLED_REASON),
            actorOrDefault(event.cancelledBy(), BOOKING_SERVICE_ACTOR));
    }

    /**
     * Activates the paid contract. A contract that is already ACTIVE is left alone.
     */
    public void onPaymentSucceeded(PaymentSucceededEvent event) {
        log.info("Handling PaymentSucceeded: contractId={}, paymentId={}", event.contractId(), event.paymentId());

        if (event.contractId() == null) {
            throw new ValidationException("PaymentSucceeded without contractId");
        }
        Contract contract = contractService.getContract(event.contractId());
        if (contract.getStatus() == ContractStatus.ACTIVE) {
            log.info("Contract {} already active, nothing to do", contract.getId());
            return;
        }
        contractService.transitionStatus(event.contractId(), ContractStatus.ACTIVE,
            PAYMENT_SUCCEEDED_REASON, PAYMENT_SERVICE_ACTOR);
    }

    private static String actorOrDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
