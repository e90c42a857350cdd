package com.flagship.service_entitlement.entitlement;

import com.flagship.service_entitlement.contract.Contract;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Writes new entitlement rows. Grants only add rows, they never touch existing
 * ones, so they need no lock on the key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntitlementGrantService {

    private final EntitlementRepository entitlementRepository;
    private final Clock clock;

    /**
     * Grants one PRODUCT row per service type of the contract's product snapshot,
     * summing quantities of repeated service types.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<EntitlementEntity> grantFromContract(Contract contract, String createdBy) {
        Instant now = clock.instant();
        List<EntitlementEntity> granted = new ArrayList<>();
        contract.getProductSnapshot().quantitiesByServiceType().forEach((serviceType, quantity) ->
                granted.add(entitlementRepository.save(EntitlementEntity.grant(
                        contract.getStudentId(), serviceType, EntitlementSource.PRODUCT, contract.getId(),
                        quantity, contract.getExpiresAt(), createdBy, now))));

        log.info("Granted {} product entitlements for contract {} (student {})",
                granted.size(), contract.getId(), contract.getStudentId());
        return granted;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EntitlementEntity grant(UUID studentId, String serviceType, EntitlementSource source, UUID contractId,
                                   int quantity, Instant expiresAt, String createdBy) {
        EntitlementEntity saved = entitlementRepository.saveAndFlush(EntitlementEntity.grant(
                studentId, serviceType, source, contractId, quantity, expiresAt, createdBy, clock.instant()));
        log.debug("Granted entitlement {}: {} x {} ({}) to student {}",
                saved.getId(), quantity, serviceType, source, studentId);
        return saved;
    }
}
