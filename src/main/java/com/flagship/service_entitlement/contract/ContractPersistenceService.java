package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.lock.RowLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Contract} domain object and its JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractPersistenceService {

    private final ContractRepository contractRepository;
    private final ContractStatusHistoryRepository historyRepository;
    private final RowLocks rowLocks;

    @Transactional
    public Contract save(Contract contract, String idempotencyKey) {
        ContractEntity saved = contractRepository.save(ContractEntity.fromDomain(contract, idempotencyKey));
        log.debug("Saved contract {} ({})", saved.getId(), saved.getContractNumber());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Contract> findById(UUID contractId) {
        return contractRepository.findById(contractId).map(ContractEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Contract> findByIdempotencyKey(String idempotencyKey) {
        return contractRepository.findByIdempotencyKey(idempotencyKey).map(ContractEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Contract> findByStudent(UUID studentId) {
        return contractRepository.findByStudentIdOrderByCreatedAtDesc(studentId)
            .stream()
            .map(ContractEntity::toDomain)
            .toList();
    }

    /**
     * Loads the contract with a row lock held until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Contract lockById(UUID contractId) {
        return rowLocks.lock("contract " + contractId, () -> contractRepository.findByIdForUpdate(contractId))
            .map(ContractEntity::toDomain)
            .orElseThrow(() -> NotFoundException.contract(contractId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Contract update(Contract contract) {
        ContractEntity existing = contractRepository.findById(contract.getId())
            .orElseThrow(() -> NotFoundException.contract(contract.getId()));
        existing.updateFromDomain(contract);
        ContractEntity updated = contractRepository.saveAndFlush(existing);
        return updated.toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ContractStatusHistory recordHistory(UUID contractId, ContractStatus fromStatus, ContractStatus toStatus,
                                               Instant changedAt, String changedBy, String reason,
                                               Map<String, Object> metadata) {
        ContractStatusHistoryEntity saved = historyRepository.save(ContractStatusHistoryEntity.record(
            contractId, fromStatus, toStatus, changedAt, changedBy, reason, metadata));
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<ContractStatusHistory> findHistory(UUID contractId) {
        return historyRepository.findByContractIdOrderByChangedAtAsc(contractId)
            .stream()
            .map(ContractStatusHistoryEntity::toDomain)
            .toList();
    }
}
