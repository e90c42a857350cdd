package com.flagship.service_entitlement.entitlement;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EntitlementRepository extends JpaRepository<EntitlementEntity, Long> {

    /**
     * SELECT ... FOR UPDATE over every row of the key, in (service_type, id) order
     * so that concurrent writers always lock in the same sequence.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM EntitlementEntity e " +
           "WHERE e.studentId = :studentId AND e.serviceType = :serviceType " +
           "ORDER BY e.serviceType, e.id")
    List<EntitlementEntity> findAllForUpdate(@Param("studentId") UUID studentId,
                                             @Param("serviceType") String serviceType);

    List<EntitlementEntity> findByStudentIdAndServiceTypeOrderByIdAsc(UUID studentId, String serviceType);

    List<EntitlementEntity> findByStudentIdOrderByServiceTypeAscIdAsc(UUID studentId);

    List<EntitlementEntity> findByContractIdOrderByIdAsc(UUID contractId);

    @Query("SELECT DISTINCT new com.flagship.service_entitlement.entitlement.EntitlementKey(e.studentId, e.serviceType) " +
           "FROM EntitlementEntity e")
    List<EntitlementKey> findAllKeys();
}
