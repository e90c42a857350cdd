package com.flagship.service_entitlement.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LedgerArchivePolicyRepository extends JpaRepository<LedgerArchivePolicyEntity, UUID> {

    List<LedgerArchivePolicyEntity> findByEnabledTrue();

    List<LedgerArchivePolicyEntity> findAllByOrderByCreatedAtAsc();
}
