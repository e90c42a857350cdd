package com.flagship.service_entitlement.contract;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for contract persistence.
 *
 * Key design principles:
 * - No setters: state only changes through {@link #updateFromDomain}
 * - Identity, ownership and the product snapshot are updatable = false
 * - Idempotency key is a persistence concern and is passed separately
 */
@Entity
@Table(name = "contracts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContractEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_number", nullable = false, updatable = false, length = 50)
    private String contractNumber;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "title")
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ContractStatus status;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "validity_days")
    private Integer validityDays;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "product_snapshot", nullable = false, updatable = false, columnDefinition = "jsonb")
    private ProductSnapshot productSnapshot;

    @Column(name = "signed_at")
    private Instant signedAt;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "suspended_at")
    private Instant suspendedAt;

    @Column(name = "suspended_reason")
    private String suspendedReason;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "terminated_at")
    private Instant terminatedAt;

    @Column(name = "terminated_reason")
    private String terminatedReason;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ContractEntity fromDomain(Contract contract, String idempotencyKey) {
        return new ContractEntity(
            contract.getId(),
            contract.getContractNumber(),
            contract.getStudentId(),
            contract.getProductId(),
            contract.getTitle(),
            contract.getStatus(),
            contract.getTotalAmount(),
            contract.getCurrency(),
            contract.getValidityDays(),
            contract.getProductSnapshot(),
            contract.getSignedAt(),
            contract.getActivatedAt(),
            contract.getSuspendedAt(),
            contract.getSuspendedReason(),
            contract.getCompletedAt(),
            contract.getTerminatedAt(),
            contract.getTerminatedReason(),
            contract.getExpiresAt(),
            idempotencyKey,
            contract.getCreatedBy(),
            contract.getCreatedAt(),
            null  // updatedAt - set by @PrePersist
        );
    }

    public Contract toDomain() {
        return Contract.builder()
            .id(id)
            .contractNumber(contractNumber)
            .studentId(studentId)
            .productId(productId)
            .title(title)
            .status(status)
            .totalAmount(totalAmount)
            .currency(currency)
            .validityDays(validityDays)
            .productSnapshot(productSnapshot)
            .signedAt(signedAt)
            .activatedAt(activatedAt)
            .suspendedAt(suspendedAt)
            .suspendedReason(suspendedReason)
            .completedAt(completedAt)
            .terminatedAt(terminatedAt)
            .terminatedReason(terminatedReason)
            .expiresAt(expiresAt)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable lifecycle and core fields from the domain object.
     * Identity, ownership, snapshot and idempotency key never change.
     */
    void updateFromDomain(Contract contract) {
        if (!this.id.equals(contract.getId())) {
            throw new IllegalArgumentException(
                "Cannot update contract " + this.id + " from contract " + contract.getId());
        }
        this.title = contract.getTitle();
        this.status = contract.getStatus();
        this.totalAmount = contract.getTotalAmount();
        this.currency = contract.getCurrency();
        this.validityDays = contract.getValidityDays();
        this.signedAt = contract.getSignedAt();
        this.activatedAt = contract.getActivatedAt();
        this.suspendedAt = contract.getSuspendedAt();
        this.suspendedReason = contract.getSuspendedReason();
        this.completedAt = contract.getCompletedAt();
        this.terminatedAt = contract.getTerminatedAt();
        this.terminatedReason = contract.getTerminatedReason();
        this.expiresAt = contract.getExpiresAt();
    }
}
