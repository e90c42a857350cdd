package com.flagship.service_entitlement.entitlement;

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
import java.util.List;
import java.util.UUID;

/**
 * Append-only amendment record. The table rejects UPDATE and DELETE.
 */
@Entity
@Immutable
@Table(name = "contract_amendment_ledgers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContractAmendmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Column(name = "service_type", nullable = false, updatable = false, length = 100)
    private String serviceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger_type", nullable = false, updatable = false, length = 20)
    private AmendmentType ledgerType;

    @Column(name = "quantity_changed", nullable = false, updatable = false)
    private int quantityChanged;

    @Column(nullable = false, updatable = false)
    private String reason;

    @Column(updatable = false)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false, columnDefinition = "jsonb")
    private List<String> attachments;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    private AmendmentSnapshot snapshot;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static ContractAmendmentEntity fromDomain(ContractAmendment amendment) {
        return new ContractAmendmentEntity(
            amendment.getId(),
            amendment.getStudentId(),
            amendment.getContractId(),
            amendment.getServiceType(),
            amendment.getLedgerType(),
            amendment.getQuantityChanged(),
            amendment.getReason(),
            amendment.getDescription(),
            amendment.getAttachments(),
            amendment.getSnapshot(),
            amendment.getCreatedBy(),
            amendment.getCreatedAt()
        );
    }

    public ContractAmendment toDomain() {
        return ContractAmendment.builder()
            .id(id)
            .studentId(studentId)
            .contractId(contractId)
            .serviceType(serviceType)
            .ledgerType(ledgerType)
            .quantityChanged(quantityChanged)
            .reason(reason)
            .description(description)
            .attachments(attachments)
            .snapshot(snapshot)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .build();
    }
}
