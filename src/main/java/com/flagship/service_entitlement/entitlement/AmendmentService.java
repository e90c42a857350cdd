package com.flagship.service_entitlement.entitlement;

import com.flagship.service_entitlement.contract.Contract;
import com.flagship.service_entitlement.contract.ContractGuard;
import com.flagship.service_entitlement.entitlement.event.EntitlementAmendedEvent;
import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import com.flagship.service_entitlement.exception.InvalidQuantityException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.ledger.LedgerEntry;
import com.flagship.service_entitlement.ledger.LedgerEntryType;
import com.flagship.service_entitlement.ledger.LedgerRepository;
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
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records addon, promotion and compensation grants against an ACTIVE contract.
 *
 * One transaction writes the new entitlement row, the amendment record, an
 * adjustment ledger entry carrying the new available balance, and the outbox event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AmendmentService {

    private final ContractGuard contractGuard;
    private final BalanceService balanceService;
    private final EntitlementGrantService grantService;
    private final ContractAmendmentRepository amendmentRepository;
    private final LedgerRepository ledgerRepository;
    private final OutboxService outboxService;
    private final EntitlementMetrics metrics;
    private final Clock clock;

    @Transactional
    public ContractAmendment addAmendment(AddAmendmentCommand command) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.put(CorrelationContext.STUDENT_ID_MDC_KEY, command.studentId());
        CorrelationContext.put(CorrelationContext.CONTRACT_ID_MDC_KEY, command.contractId());

        try {
            if (command.quantityChanged() <= 0) {
                throw new InvalidQuantityException(command.quantityChanged());
            }
            if (command.reason() == null || command.reason().isBlank()) {
                throw new ValidationException("An amendment requires a reason");
            }
            if (command.ledgerType() == null) {
                throw new ValidationException("Amendment type is required");
            }
            if (command.createdBy() == null || command.createdBy().isBlank()) {
                throw new ValidationException("createdBy is required");
            }

            Contract contract = contractGuard.requireActiveFor(command.contractId(), command.studentId());
            LockedEntitlements locked = balanceService.lockEntitlementsAllowEmpty(
                    command.studentId(), command.serviceType());

            EntitlementEntity row = grantService.grant(command.studentId(), command.serviceType(),
                    command.ledgerType().toSource(), contract.getId(), command.quantityChanged(),
                    contract.getExpiresAt(), command.createdBy());
            locked.add(row);
            int balanceAfter = locked.totalAvailable();

            Instant now = clock.instant();
            ContractAmendment amendment = ContractAmendment.builder()
                    .id(UUID.randomUUID())
                    .studentId(command.studentId())
                    .contractId(contract.getId())
                    .serviceType(command.serviceType())
                    .ledgerType(command.ledgerType())
                    .quantityChanged(command.quantityChanged())
                    .reason(command.reason())
                    .description(command.description())
                    .attachments(command.attachments() == null ? List.of() : List.copyOf(command.attachments()))
                    .snapshot(new AmendmentSnapshot(contract.getId(), contract.getContractNumber(),
                            contract.getStatus().name()))
                    .createdBy(command.createdBy())
                    .createdAt(now)
                    .build();
            ContractAmendment saved = amendmentRepository.save(ContractAmendmentEntity.fromDomain(amendment)).toDomain();

            ledgerRepository.insert(LedgerEntry.adjustment(command.studentId(), command.serviceType(),
                    command.quantityChanged(), balanceAfter, command.reason(),
                    Map.of("amendmentId", saved.getId().toString(), "ledgerType", command.ledgerType().name()),
                    command.createdBy(), now));

            outboxService.saveEvent(AggregateTypes.STUDENT_ENTITLEMENT, command.studentId(),
                    new EntitlementAmendedEvent(UUID.randomUUID(), saved.getId(), command.studentId(),
                            contract.getId(), command.serviceType(), command.ledgerType().name(),
                            command.quantityChanged(), row.getId(), balanceAfter, command.reason(),
                            command.createdBy(), now));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLedgerEntries(LedgerEntryType.ADJUSTMENT.dbValue(), 1);
            metrics.recordSuccess("amendment.add", duration);
            log.info("Amendment added: id={}, type={}, serviceType={}, quantity={}, balanceAfter={}, duration={}ms",
                    saved.getId(), command.ledgerType(), command.serviceType(), command.quantityChanged(),
                    balanceAfter, duration);
            return saved;

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordFailure("amendment.add", e, duration);
            if (e instanceof EntitlementLedgerException) {
                log.warn("Amendment rejected: {}, duration={}ms", e.getMessage(), duration);
            } else {
                log.error("Amendment failed: {}, duration={}ms", e.getMessage(), duration, e);
            }
            throw e;
        } finally {
            CorrelationContext.clear(CorrelationContext.STUDENT_ID_MDC_KEY, CorrelationContext.CONTRACT_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public List<ContractAmendment> listAmendments(UUID studentId) {
        if (studentId == null) {
            throw new ValidationException("Student ID is required");
        }
        return amendmentRepository.findByStudentIdOrderByCreatedAtDesc(studentId)
                .stream()
                .map(ContractAmendmentEntity::toDomain)
                .toList();
    }
}
