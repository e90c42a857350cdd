package com.flagship.service_entitlement.contract;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only history row. The table rejects UPDATE and DELETE at the database level.
 */
@Entity
@Immutable
@Table(name = "contract_status_history")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContractStatusHistoryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", updatable = false, length = 20)
    private ContractStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, updatable = false, length = 20)
    private ContractStatus toStatus;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;

    @Column(name = "changed_by", updatable = false, length = 100)
    private String changedBy;

    @Column(name = "reason", updatable = false)
    private String reason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    static ContractStatusHistoryEntity record(UUID contractId, ContractStatus fromStatus,
                                              ContractStatus toStatus, Instant changedAt,
                                              String changedBy, String reason,
                                              Map<String, Object> metadata) {
        return new ContractStatusHistoryEntity(
            UUID.randomUUID(), contractId, fromStatus, toStatus, changedAt, changedBy, reason, metadata);
    }

    public ContractStatusHistory toDomain() {
        return new ContractStatusHistory(id, contractId, fromStatus, toStatus, changedAt, changedBy, reason, metadata);
    }
}
