package com.flagship.service_entitlement.hold;

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

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for service holds. Only the closing fields are updatable.
 */
@Entity
@Table(name = "service_holds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ServiceHoldEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "service_type", nullable = false, updatable = false, length = 100)
    private String serviceType;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private HoldStatus status;

    @Column(name = "related_booking_id", updatable = false)
    private UUID relatedBookingId;

    @Column(name = "expiry_at", updatable = false)
    private Instant expiryAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    @Column(name = "release_reason")
    private String releaseReason;

    @Column(name = "released_by", length = 100)
    private String releasedBy;

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

    static ServiceHoldEntity fromDomain(ServiceHold hold) {
        return new ServiceHoldEntity(
            hold.getId(),
            hold.getContractId(),
            hold.getStudentId(),
            hold.getServiceType(),
            hold.getQuantity(),
            hold.getStatus(),
            hold.getRelatedBookingId(),
            hold.getExpiryAt(),
            hold.getReleasedAt(),
            hold.getReleaseReason(),
            hold.getReleasedBy(),
            hold.getCreatedBy(),
            hold.getCreatedAt(),
            null
        );
    }

    public ServiceHold toDomain() {
        return ServiceHold.builder()
            .id(id)
            .contractId(contractId)
            .studentId(studentId)
            .serviceType(serviceType)
            .quantity(quantity)
            .status(status)
            .relatedBookingId(relatedBookingId)
            .expiryAt(expiryAt)
            .releasedAt(releasedAt)
            .releaseReason(releaseReason)
            .releasedBy(releasedBy)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(ServiceHold hold) {
        if (!this.id.equals(hold.getId())) {
            throw new IllegalArgumentException("Cannot update hold " + this.id + " from hold " + hold.getId());
        }
        this.status = hold.getStatus();
        this.releasedAt = hold.getReleasedAt();
        this.releaseReason = hold.getReleaseReason();
        this.releasedBy = hold.getReleasedBy();
    }
}
