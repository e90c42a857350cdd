package com.flagship.service_entitlement.entitlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One entitlement grant for a (student, service type) key.
 *
 * The row id is monotonic and defines FIFO order across a student's grants.
 * Quantities only change through the mutators below, each of which keeps
 * {@code consumed + held <= total} with every quantity non-negative. The same
 * rule is enforced by CHECK constraints on service_entitlements.
 *
 * Mutators are package-private: callers go through {@link LockedEntitlements},
 * which validates the business rule for the whole key first.
 */
@Entity
@Table(name = "service_entitlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EntitlementEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "service_type", nullable = false, updatable = false, length = 100)
    private String serviceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private EntitlementSource source;

    @Column(name = "contract_id", updatable = false)
    private UUID contractId;

    @Column(name = "total_quantity", nullable = false)
    private int totalQuantity;

    @Column(name = "consumed_quantity", nullable = false)
    private int consumedQuantity;

    @Column(name = "held_quantity", nullable = false)
    private int heldQuantity;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static EntitlementEntity grant(UUID studentId, String serviceType, EntitlementSource source,
                                          UUID contractId, int quantity, Instant expiresAt,
                                          String createdBy, Instant now) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Granted quantity must be positive: " + quantity);
        }
        EntitlementEntity entity = new EntitlementEntity();
        entity.studentId = studentId;
        entity.serviceType = serviceType;
        entity.source = source;
        entity.contractId = contractId;
        entity.totalQuantity = quantity;
        entity.consumedQuantity = 0;
        entity.heldQuantity = 0;
        entity.expiresAt = expiresAt;
        entity.createdBy = createdBy;
        entity.createdAt = now;
        return entity;
    }

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

    public int getAvailableQuantity() {
        return totalQuantity - consumedQuantity - heldQuantity;
    }

    void consume(int quantity) {
        requirePositive(quantity);
        requireAtMost(quantity, getAvailableQuantity(), "consume");
        consumedQuantity += quantity;
    }

    void restoreConsumed(int quantity) {
        requirePositive(quantity);
        requireAtMost(quantity, consumedQuantity, "restore");
        consumedQuantity -= quantity;
    }

    void hold(int quantity) {
        requirePositive(quantity);
        requireAtMost(quantity, getAvailableQuantity(), "hold");
        heldQuantity += quantity;
    }

    void releaseHeld(int quantity) {
        requirePositive(quantity);
        requireAtMost(quantity, heldQuantity, "release");
        heldQuantity -= quantity;
    }

    void increaseTotal(int quantity) {
        requirePositive(quantity);
        totalQuantity += quantity;
    }

    void decreaseTotal(int quantity) {
        requirePositive(quantity);
        requireAtMost(quantity, getAvailableQuantity(), "remove");
        totalQuantity -= quantity;
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }

    private void requireAtMost(int quantity, int limit, String action) {
        if (quantity > limit) {
            throw new IllegalStateException(String.format(
                "Cannot %s %d units on entitlement %d (limit %d)", action, quantity, id, limit));
        }
    }
}
