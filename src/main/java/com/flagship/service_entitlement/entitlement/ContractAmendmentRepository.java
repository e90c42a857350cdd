package com.flagship.service_entitlement.entitlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContractAmendmentRepository extends JpaRepository<ContractAmendmentEntity, UUID> {

    List<ContractAmendmentEntity> findByStudentIdOrderByCreatedAtDesc(UUID studentId);
}
