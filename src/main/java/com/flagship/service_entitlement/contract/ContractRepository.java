package com.flagship.service_entitlement.contract;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContractRepository extends JpaRepository<ContractEntity, UUID> {

    Optional<ContractEntity> findByIdempotencyKey(String idempotencyKey);

    List<ContractEntity> findByStudentIdOrderByCreatedAtDesc(UUID studentId);

    /**
     * Loads a contract with a row lock so concurrent transitions serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ContractEntity c WHERE c.id = :id")
    Optional<ContractEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Loads a contract with a share lock: entitlement writers proceed together,
     * but a concurrent transition waits for them and they wait for it.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT c FROM ContractEntity c WHERE c.id = :id")
    Optional<ContractEntity> findByIdForShare(@Param("id") UUID id);
}
