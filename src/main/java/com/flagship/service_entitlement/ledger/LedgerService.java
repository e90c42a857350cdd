package com.flagship.service_entitlement.ledger;

import com.flagship.service_entitlement.contract.ContractGuard;
import com.flagship.service_entitlement.entitlement.BalanceService;
import com.flagship.service_entitlement.entitlement.LockedEntitlements;
import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import com.flagship.service_entitlement.exception.ExceedsConsumedException;
import com.flagship.service_entitlement.exception.InvalidQuantityException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.hold.HoldService;
import com.flagship.service_entitlement.ledger.event.BalanceAdjustedEvent;
import com.flagship.service_entitlement.ledger.event.ServiceConsumedEvent;
import com.flagship.service_entitlement.ledger.event.ServiceRefundedEvent;
import com.flagship.service_entitlement.observability.CorrelationContext;
import com.flagship.service_entitlement.observability.EntitlementMetrics;
import com.flagship.service_entitlement.outbox.AggregateTypes;
import com.flagship.service_entitlement.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appends consumption, adjustment and refund entries to the service ledger.
 *
 * Each operation is one transaction: lock the key's entitlement rows, validate,
 * mutate the rows, append ledger entries and write the outbox event. Balances
 * are updated here, next to the ledger insert, never by database triggers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final String BOOKING_SOURCE_KEY = "bookingSource";

    private final BalanceService balanceService;
    private final LedgerRepository ledgerRepository;
    private final HoldService holdService;
    private final ContractGuard contractGuard;
    private final OutboxService outboxService;
    private final EntitlementMetrics metrics;
    private final Clock clock;

    /**
     * Consumes units, oldest entitlement row first, writing one entry per row
     * touched. A related hold is closed first and its units are returned to the
     * pool the consumption draws from.
     *
     * @return the entries written, in deduction order
     */
    @Transactional
    public List<LedgerEntry> recordConsumption(ConsumeCommand command) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.STUDENT_ID_MDC_KEY, command.studentId());
        CorrelationContext.put(CorrelationContext.CONTRACT_ID_MDC_KEY, command.contractId());

        try {
            if (command.quantity() <= 0) {
                throw new InvalidQuantityException(command.quantity());
            }
            requireCreatedBy(command.createdBy());
            requireBookingSource(command.relatedBookingId(), command.bookingSource());

            if (command.contractId() != null) {
                contractGuard.requireActiveFor(command.contractId(), command.studentId());
            }

            LockedEntitlements locked = balanceService.lockEntitlements(command.studentId(), command.serviceType());
            if (command.relatedHoldId() != null) {
                holdService.completeHold(command.relatedHoldId(), locked, command.createdBy());
            }

            Instant now = clock.instant();
            Map<String, Object> metadata = command.relatedBookingId() != null
                    ? Map.of(BOOKING_SOURCE_KEY, command.bookingSource())
                    : null;

            List<LedgerEntry> entries = new ArrayList<>();
            for (LockedEntitlements.Allocation allocation : locked.consume(command.quantity())) {
                entries.add(ledgerRepository.insert(LedgerEntry.consumption(
                        command.studentId(), command.serviceType(), allocation.quantity(),
                        allocation.balanceAfter(), command.relatedBookingId(), command.relatedHoldId(),
                        metadata, command.createdBy(), now)));
            }

            int balanceAfter = entries.get(entries.size() - 1).getBalanceAfter();
            outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, command.studentId(),
                    new ServiceConsumedEvent(UUID.randomUUID(), command.studentId(), command.serviceType(),
                            command.quantity(), balanceAfter, entries.stream().map(LedgerEntry::getId).toList(),
                            command.relatedBookingId(), command.relatedHoldId(), command.contractId(),
                            command.bookingSource(), command.createdBy(), now));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLedgerEntries(LedgerEntryType.CONSUMPTION.dbValue(), entries.size());
            metrics.recordSuccess("ledger.consume", duration);
            log.info("Consumed {} x {}: entries={}, balanceAfter={}, bookingId={}, duration={}ms",
                    command.quantity(), command.serviceType(), entries.size(), balanceAfter,
                    command.relatedBookingId(), duration);
            return entries;

        } catch (Exception e) {
            recordFailure("ledger.consume", e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.STUDENT_ID_MDC_KEY, CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    /**
     * Applies a signed manual correction to the balance of a key.
     */
    @Transactional
    public LedgerEntry recordAdjustment(UUID studentId, String serviceType, int quantity,
                                        String reason, String createdBy) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.STUDENT_ID_MDC_KEY, studentId);

        try {
            if (quantity == 0) {
                throw new ValidationException("Adjustment quantity cannot be zero");
            }
            if (reason == null || reason.isBlank()) {
                throw new ValidationException("An adjustment requires a reason");
            }
            requireCreatedBy(createdBy);

            LockedEntitlements locked = balanceService.lockEntitlements(studentId, serviceType);
            int balanceAfter = locked.adjust(quantity);

            LedgerEntry entry = ledgerRepository.insert(LedgerEntry.adjustment(
                    studentId, serviceType, quantity, balanceAfter, reason, null, createdBy, clock.instant()));
            outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, studentId, BalanceAdjustedEvent.fromEntry(entry));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLedgerEntries(LedgerEntryType.ADJUSTMENT.dbValue(), 1);
            metrics.recordSuccess("ledger.adjust", duration);
            log.info("Adjusted {} by {}: balanceAfter={}, reason={}, duration={}ms",
                    serviceType, quantity, balanceAfter, reason, duration);
            return entry;

        } catch (Exception e) {
            recordFailure("ledger.adjust", e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.STUDENT_ID_MDC_KEY);
        }
    }

    /**
     * Returns consumed units, newest entitlement row first. The refund may not
     * exceed what has been consumed and not yet refunded, counting archived
     * entries too.
     */
    @Transactional
    public LedgerEntry recordRefund(RefundCommand command) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.STUDENT_ID_MDC_KEY, command.studentId());

        try {
            if (command.quantity() <= 0) {
                throw new InvalidQuantityException(command.quantity());
            }
            requireCreatedBy(command.createdBy());
            requireBookingSource(command.relatedBookingId(), command.bookingSource());

            LockedEntitlements locked = balanceService.lockEntitlements(command.studentId(), command.serviceType());
            int netConsumed = ledgerRepository.sumTotals(command.studentId(), command.serviceType()).netConsumed();
            if (command.quantity() > netConsumed) {
                throw new ExceedsConsumedException(command.serviceType(), netConsumed, command.quantity());
            }

            int balanceAfter = locked.restoreConsumed(command.quantity());
            Map<String, Object> metadata = command.relatedBookingId() != null
                    ? Map.of(BOOKING_SOURCE_KEY, command.bookingSource())
                    : null;

            LedgerEntry entry = ledgerRepository.insert(LedgerEntry.refund(
                    command.studentId(), command.serviceType(), command.quantity(), balanceAfter,
                    command.relatedBookingId(), metadata, command.reason(), command.createdBy(), clock.instant()));
            outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, command.studentId(),
                    ServiceRefundedEvent.fromEntry(entry));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLedgerEntries(LedgerEntryType.REFUND.dbValue(), 1);
            metrics.recordSuccess("ledger.refund", duration);
            log.info("Refunded {} x {}: balanceAfter={}, bookingId={}, duration={}ms",
                    command.quantity(), command.serviceType(), balanceAfter, command.relatedBookingId(), duration);
            return entry;

        } catch (Exception e) {
            recordFailure("ledger.refund", e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.STUDENT_ID_MDC_KEY);
        }
    }

    private void recordFailure(String operation, Exception e, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metrics.recordFailure(operation, e, duration);
        if (e instanceof EntitlementLedgerException) {
            log.warn("{} rejected: {}, duration={}ms", operation, e.getMessage(), duration);
        } else {
            log.error("{} failed: {}, duration={}ms", operation, e.getMessage(), duration, e);
        }
    }

    private static void requireCreatedBy(String createdBy) {
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("createdBy is required");
        }
    }

    private static void requireBookingSource(UUID relatedBookingId, String bookingSource) {
        if (relatedBookingId != null && (bookingSource == null || bookingSource.isBlank())) {
            throw new ValidationException("bookingSource is required when relatedBookingId is set");
        }
    }
}
