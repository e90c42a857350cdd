package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Eligibility check run before any contract-bound entitlement mutation.
 *
 * The contract stays share-locked for the rest of the caller's transaction, so a
 * concurrent suspension or termination waits for the mutation to commit. Lock
 * order is contract first, then entitlement rows, as in status transitions.
 */
@Component
@RequiredArgsConstructor
public class ContractGuard {

    private final ContractDirectory contractDirectory;

    /**
     * @throws NotFoundException if the contract does not exist
     * @throws com.flagship.service_entitlement.exception.ContractNotActiveException if it is not ACTIVE
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Contract requireActive(UUID contractId) {
        if (contractId == null) {
            throw new ValidationException("Contract ID is required");
        }
        Contract contract = contractDirectory.findContract(contractId)
            .orElseThrow(() -> NotFoundException.contract(contractId));
        contract.requireActive();
        return contract;
    }

    /**
     * As {@link #requireActive(UUID)}, and the contract must belong to {@code studentId}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Contract requireActiveFor(UUID contractId, UUID studentId) {
        Contract contract = requireActive(contractId);
        if (!contract.getStudentId().equals(studentId)) {
            throw new ValidationException(String.format(
                "Contract %s does not belong to student %s", contractId, studentId));
        }
        return contract;
    }
}
