package com.flagship.service_entitlement.contract;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContractStatusHistoryRepository extends JpaRepository<ContractStatusHistoryEntity, UUID> {

    List<ContractStatusHistoryEntity> findByContractIdOrderByChangedAtAsc(UUID contractId);
}
