package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.contract.event.ContractCreatedEvent;
import com.flagship.service_entitlement.contract.event.ContractStatusChangedEvent;
import com.flagship.service_entitlement.contract.event.ContractUpdatedEvent;
import com.flagship.service_entitlement.entitlement.EntitlementGrantService;
import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.hold.HoldService;
import com.flagship.service_entitlement.observability.CorrelationContext;
import com.flagship.service_entitlement.observability.EntitlementMetrics;
import com.flagship.service_entitlement.outbox.AggregateTypes;
import com.flagship.service_entitlement.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract lifecycle orchestration.
 *
 * Key principles:
 * - The contract row is locked for every change; the status moves only through
 *   {@link Contract#transitionTo}
 * - Every transition writes a history row and an outbox event in the same
 *   transaction as the contract update
 * - Entitlement side effects (first-activation grants, hold cancellation on
 *   termination) commit or roll back with the transition
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private static final String SYSTEM_ACTOR = "system";

    private final ContractPersistenceService persistenceService;
    private final ContractDirectory contractDirectory;
    private final ContractNumberGenerator numberGenerator;
    private final ContractIdempotencyService idempotencyService;
    private final EntitlementGrantService grantService;
    private final HoldService holdService;
    private final OutboxService outboxService;
    private final EntitlementMetrics metrics;
    private final Clock clock;

    /**
     * Creates a DRAFT contract whose product snapshot is taken from the catalog now.
     * A repeated Idempotency-Key returns the contract created the first time.
     */
    @Transactional
    public ContractCreationResult createContract(CreateContractCommand command, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.STUDENT_ID_MDC_KEY, command.studentId());

        try {
            Optional<Contract> existing = idempotencyService.findContractId(idempotencyKey)
                    .flatMap(persistenceService::findById);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotent contract create: key={}, contractId={}", idempotencyKey, existing.get().getId());
                return new ContractCreationResult(existing.get(), false);
            }
            metrics.recordIdempotencyMiss();

            if (command.productId() == null) {
                throw new ValidationException("Product ID is required");
            }
            ProductSnapshot snapshot = ProductSnapshot.of(command.productId(),
                    contractDirectory.listProductItems(command.productId()));

            Instant now = clock.instant();
            Contract draft = Contract.draft(UUID.randomUUID(), numberGenerator.next(), command.studentId(),
                    command.productId(), command.title(), command.totalAmount(), command.currency(),
                    command.validityDays(), snapshot, command.createdBy(), now);

            Contract saved = persistenceService.save(draft, idempotencyKey);
            persistenceService.recordHistory(saved.getId(), null, ContractStatus.DRAFT, now,
                    command.createdBy(), null, Map.of("contractNumber", saved.getContractNumber()));
            outboxService.saveEvent(AggregateTypes.CONTRACT, saved.getId(), ContractCreatedEvent.fromContract(saved));
            rememberAfterCommit(idempotencyKey, saved.getId());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSuccess("contract.create", duration);
            log.info("Contract created: contractId={}, number={}, productId={}, items={}, duration={}ms",
                    saved.getId(), saved.getContractNumber(), saved.getProductId(),
                    snapshot.items().size(), duration);
            return new ContractCreationResult(saved, true);

        } catch (Exception e) {
            recordFailure("contract.create", e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.STUDENT_ID_MDC_KEY);
        }
    }

    /**
     * Changes title, amount, currency or validity of a DRAFT contract.
     */
    @Transactional
    public Contract updateCoreFields(UUID contractId, ContractCoreUpdate update, String actorId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId);

        try {
            Contract contract = persistenceService.lockById(contractId);
            Contract updated = persistenceService.update(contract.updateCoreFields(update, clock.instant()));
            outboxService.saveEvent(AggregateTypes.CONTRACT, contractId,
                    ContractUpdatedEvent.fromContract(updated, actorId));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSuccess("contract.update", duration);
            log.info("Contract core fields updated by {}: duration={}ms", actorId, duration);
            return updated;

        } catch (Exception e) {
            recordFailure("contract.update", e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    /**
     * Moves a contract to {@code target}.
     *
     * The first activation grants the product entitlements; termination cancels
     * every ACTIVE hold of the contract.
     *
     * @throws com.flagship.service_entitlement.exception.InvalidStateTransitionException if the move is not allowed
     * @throws ValidationException if SUSPENDED or TERMINATED is requested without a reason
     */
    @Transactional
    public Contract transitionStatus(UUID contractId, ContractStatus target, String reason, String actorId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.CONTRACT_ID_MDC_KEY, contractId);
        String actor = actorId == null || actorId.isBlank() ? SYSTEM_ACTOR : actorId;

        try {
            Contract contract = persistenceService.lockById(contractId);
            ContractStatus from = contract.getStatus();
            Instant now = clock.instant();

            boolean firstActivation = contract.isFirstActivation(target);
            Contract moved = contract.transitionTo(target, reason, now);
            Contract updated = persistenceService.update(moved);

            int granted = 0;
            if (firstActivation) {
                granted = grantService.grantFromContract(updated, actor).size();
            }
            int holdsCancelled = 0;
            if (target == ContractStatus.TERMINATED) {
                holdsCancelled = holdService.cancelActiveHoldsForContract(contractId,
                        "contract terminated: " + reason, actor);
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            if (granted > 0) {
                metadata.put("entitlementsGranted", granted);
            }
            if (holdsCancelled > 0) {
                metadata.put("holdsCancelled", holdsCancelled);
            }
            persistenceService.recordHistory(contractId, from, target, now, actor, reason,
                    metadata.isEmpty() ? null : metadata);
            outboxService.saveEvent(AggregateTypes.CONTRACT, contractId,
                    new ContractStatusChangedEvent(UUID.randomUUID(), contractId, updated.getStudentId(),
                            from.name(), target.name(), reason, actor, granted, holdsCancelled, now));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordContractTransition(from.name(), target.name());
            metrics.recordSuccess("contract.transition", duration);
            log.info("Contract transitioned {} -> {}: granted={}, holdsCancelled={}, duration={}ms",
                    from, target, granted, holdsCancelled, duration);
            return updated;

        } catch (Exception e) {
            recordFailure("contract.transition", e, startTime);
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Contract getContract(UUID contractId) {
        return persistenceService.findById(contractId)
                .orElseThrow(() -> NotFoundException.contract(contractId));
    }

    @Transactional(readOnly = true)
    public List<Contract> listContracts(UUID studentId) {
        if (studentId == null) {
            throw new ValidationException("Student ID is required");
        }
        return persistenceService.findByStudent(studentId);
    }

    /**
     * Status history of a contract, oldest first, starting with its creation.
     */
    @Transactional(readOnly = true)
    public List<ContractStatusHistory> getStatusHistory(UUID contractId) {
        if (persistenceService.findById(contractId).isEmpty()) {
            throw NotFoundException.contract(contractId);
        }
        return persistenceService.findHistory(contractId);
    }

    private void rememberAfterCommit(String idempotencyKey, UUID contractId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyService.remember(idempotencyKey, contractId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.remember(idempotencyKey, contractId);
            }
        });
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
