package com.flagship.service_entitlement.hold;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ServiceHoldRepository extends JpaRepository<ServiceHoldEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM ServiceHoldEntity h WHERE h.id = :id")
    Optional<ServiceHoldEntity> findByIdForUpdate(@Param("id") UUID id);

    List<ServiceHoldEntity> findByContractIdAndStatusOrderByCreatedAtAsc(UUID contractId, HoldStatus status);

    List<ServiceHoldEntity> findByContractIdAndServiceTypeAndStatusOrderByCreatedAtAsc(
            UUID contractId, String serviceType, HoldStatus status);

    /**
     * IDs of ACTIVE holds whose expiry time has passed, oldest expiry first.
     */
    @Query("SELECT h.id FROM ServiceHoldEntity h " +
           "WHERE h.status = com.flagship.service_entitlement.hold.HoldStatus.ACTIVE " +
           "AND h.expiryAt IS NOT NULL AND h.expiryAt <= :now " +
           "ORDER BY h.expiryAt ASC")
    List<UUID> findDueHoldIds(@Param("now") Instant now, Pageable pageable);
}
