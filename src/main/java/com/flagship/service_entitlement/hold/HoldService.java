package com.flagship.service_entitlement.hold;

import com.flagship.service_entitlement.contract.ContractGuard;
import com.flagship.service_entitlement.entitlement.BalanceService;
import com.flagship.service_entitlement.entitlement.LockedEntitlements;
import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import com.flagship.service_entitlement.exception.HoldNotActiveException;
import com.flagship.service_entitlement.exception.InvalidQuantityException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.hold.event.HoldCancelledEvent;
import com.flagship.service_entitlement.hold.event.HoldCreatedEvent;
import com.flagship.service_entitlement.hold.event.HoldExpiredEvent;
import com.flagship.service_entitlement.hold.event.HoldReleasedEvent;
import com.flagship.service_entitlement.lock.RowLocks;
import com.flagship.service_entitlement.observability.CorrelationContext;
import com.flagship.service_entitlement.observability.EntitlementMetrics;
import com.flagship.service_entitlement.outbox.AggregateTypes;
import com.flagship.service_entitlement.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Places and closes reservation holds.
 *
 * Key principles:
 * - A hold and the held units on its entitlement rows change in one transaction
 * - Entitlement rows of the key are locked before the hold row
 * - Each call is a short transaction; nothing stays locked across a booking round-trip
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HoldService {

    private final ServiceHoldRepository holdRepository;
    private final BalanceService balanceService;
    private final ContractGuard contractGuard;
    private final RowLocks rowLocks;
    private final OutboxService outboxService;
    private final EntitlementMetrics metrics;
    private final Clock clock;

    /**
     * Reserves units of an ACTIVE contract owned by the student.
     */
    @Transactional
    public ServiceHold createHold(CreateHoldCommand command) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.STUDENT_ID_MDC_KEY, command.studentId());
        CorrelationContext.put(CorrelationContext.CONTRACT_ID_MDC_KEY, command.contractId());

        try {
            if (command.quantity() <= 0) {
                throw new InvalidQuantityException(command.quantity());
            }
            ServiceHold hold = ServiceHold.create(UUID.randomUUID(), command.contractId(), command.studentId(),
                    command.serviceType(), command.quantity(), command.relatedBookingId(), command.expiryAt(),
                    command.createdBy(), clock.instant());

            contractGuard.requireActiveFor(command.contractId(), command.studentId());
            LockedEntitlements locked = balanceService.lockEntitlements(command.studentId(), command.serviceType());
            locked.hold(command.quantity());

            ServiceHold saved = holdRepository.save(ServiceHoldEntity.fromDomain(hold)).toDomain();
            outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, saved.getStudentId(),
                    HoldCreatedEvent.fromHold(saved, clock.instant()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordHoldTransition(HoldStatus.ACTIVE.name());
            metrics.recordSuccess("hold.create", duration);
            log.info("Hold created: holdId={}, serviceType={}, quantity={}, available={}, duration={}ms",
                    saved.getId(), saved.getServiceType(), saved.getQuantity(), locked.totalAvailable(), duration);
            return saved;

        } catch (Exception e) {
            recordFailure("hold.create", e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.STUDENT_ID_MDC_KEY, CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    @Transactional
    public ServiceHold releaseHold(UUID holdId, String reason, String releasedBy) {
        return closeHold("hold.release", holdId, hold -> hold.release(reason, releasedBy, clock.instant()));
    }

    @Transactional
    public ServiceHold cancelHold(UUID holdId, String reason, String cancelledBy) {
        return closeHold("hold.cancel", holdId, hold -> hold.cancel(reason, cancelledBy, clock.instant()));
    }

    @Transactional
    public ServiceHold expireHold(UUID holdId) {
        return closeHold("hold.expire", holdId, hold -> hold.markAsExpired(clock.instant()));
    }

    /**
     * Releases a hold whose session has just been consumed. The caller already
     * holds the entitlement locks of the hold's key.
     *
     * @throws HoldNotActiveException if the hold is closed
     * @throws ValidationException if the hold belongs to another student or service type
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ServiceHold completeHold(UUID holdId, LockedEntitlements locked, String completedBy) {
        ServiceHoldEntity entity = lockHold(holdId);
        ServiceHold hold = entity.toDomain();

        if (!hold.isActive()) {
            throw new HoldNotActiveException(holdId, hold.getStatus());
        }
        if (!hold.getStudentId().equals(locked.getStudentId())
                || !hold.getServiceType().equals(locked.getServiceType())) {
            throw new ValidationException(String.format(
                    "Hold %s belongs to student %s / %s, not %s / %s", holdId,
                    hold.getStudentId(), hold.getServiceType(), locked.getStudentId(), locked.getServiceType()));
        }

        ServiceHold released = hold.release(ServiceHold.REASON_COMPLETED, completedBy, clock.instant());
        locked.releaseHeld(released.getQuantity());
        entity.updateFromDomain(released);
        holdRepository.save(entity);

        outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, released.getStudentId(),
                HoldReleasedEvent.fromHold(released));
        metrics.recordHoldTransition(released.getStatus().name());
        log.debug("Hold {} completed by consumption, {} units returned", holdId, released.getQuantity());
        return released;
    }

    /**
     * Cancels every ACTIVE hold of a contract, returning the held units.
     * Keys are locked in service type order.
     *
     * @return number of holds cancelled
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int cancelActiveHoldsForContract(UUID contractId, String reason, String cancelledBy) {
        List<ServiceHold> active = holdRepository
                .findByContractIdAndStatusOrderByCreatedAtAsc(contractId, HoldStatus.ACTIVE)
                .stream()
                .map(ServiceHoldEntity::toDomain)
                .toList();
        if (active.isEmpty()) {
            return 0;
        }

        Map<String, List<ServiceHold>> byServiceType = active.stream()
                .collect(Collectors.groupingBy(ServiceHold::getServiceType, TreeMap::new, Collectors.toList()));

        int cancelled = 0;
        for (Map.Entry<String, List<ServiceHold>> group : byServiceType.entrySet()) {
            UUID studentId = group.getValue().get(0).getStudentId();
            LockedEntitlements locked = balanceService.lockEntitlements(studentId, group.getKey());

            for (ServiceHold candidate : group.getValue()) {
                ServiceHoldEntity entity = lockHold(candidate.getId());
                ServiceHold current = entity.toDomain();
                if (!current.isActive()) {
                    continue;
                }
                ServiceHold closed = current.cancel(reason, cancelledBy, clock.instant());
                locked.releaseHeld(closed.getQuantity());
                entity.updateFromDomain(closed);
                holdRepository.save(entity);
                outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, closed.getStudentId(),
                        HoldCancelledEvent.fromHold(closed));
                metrics.recordHoldTransition(closed.getStatus().name());
                cancelled++;
            }
        }

        log.info("Cancelled {} active holds of contract {}", cancelled, contractId);
        return cancelled;
    }

    @Transactional(readOnly = true)
    public ServiceHold getHold(UUID holdId) {
        return holdRepository.findById(holdId)
                .map(ServiceHoldEntity::toDomain)
                .orElseThrow(() -> NotFoundException.hold(holdId));
    }

    /**
     * ACTIVE holds of a contract, optionally narrowed to one service type.
     */
    @Transactional(readOnly = true)
    public List<ServiceHold> listActiveHolds(UUID contractId, String serviceType) {
        if (contractId == null) {
            throw new ValidationException("Contract ID is required");
        }
        List<ServiceHoldEntity> entities = serviceType == null || serviceType.isBlank()
                ? holdRepository.findByContractIdAndStatusOrderByCreatedAtAsc(contractId, HoldStatus.ACTIVE)
                : holdRepository.findByContractIdAndServiceTypeAndStatusOrderByCreatedAtAsc(
                        contractId, serviceType, HoldStatus.ACTIVE);
        return entities.stream().map(ServiceHoldEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findDueHoldIds(int limit) {
        return holdRepository.findDueHoldIds(clock.instant(), PageRequest.of(0, limit));
    }

    private ServiceHold closeHold(String operation, UUID holdId, UnaryOperator<ServiceHold> transition) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.HOLD_ID_MDC_KEY, holdId);

        try {
            ServiceHold current = getHold(holdId);
            if (!current.isActive()) {
                throw new HoldNotActiveException(holdId, current.getStatus());
            }

            LockedEntitlements locked = balanceService.lockEntitlements(current.getStudentId(), current.getServiceType());
            ServiceHoldEntity entity = lockHold(holdId);

            ServiceHold closed = transition.apply(entity.toDomain());
            locked.releaseHeld(closed.getQuantity());
            entity.updateFromDomain(closed);
            holdRepository.save(entity);

            outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, closed.getStudentId(), closedEvent(closed));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordHoldTransition(closed.getStatus().name());
            metrics.recordSuccess(operation, duration);
            log.info("Hold {}: status={}, reason={}, returned={}, duration={}ms",
                    holdId, closed.getStatus(), closed.getReleaseReason(), closed.getQuantity(), duration);
            return closed;

        } catch (Exception e) {
            recordFailure(operation, e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.HOLD_ID_MDC_KEY);
        }
    }

    private ServiceHoldEntity lockHold(UUID holdId) {
        return rowLocks.lock("hold " + holdId, () -> holdRepository.findByIdForUpdate(holdId))
                .orElseThrow(() -> NotFoundException.hold(holdId));
    }

    private static EntitlementEvent closedEvent(ServiceHold hold) {
        return switch (hold.getStatus()) {
            case RELEASED -> HoldReleasedEvent.fromHold(hold);
            case CANCELLED -> HoldCancelledEvent.fromHold(hold);
            case EXPIRED -> HoldExpiredEvent.fromHold(hold);
            case ACTIVE -> throw new IllegalStateException("Hold " + hold.getId() + " is still active");
        };
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
}
