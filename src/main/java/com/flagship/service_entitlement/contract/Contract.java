package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.exception.ContractNotActiveException;
import com.flagship.service_entitlement.exception.ContractNotDraftException;
import com.flagship.service_entitlement.exception.InvalidStateTransitionException;
import com.flagship.service_entitlement.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Contract domain object.
 *
 * Key principles:
 * - Status only changes through {@link #transitionTo}, which enforces the
 *   {@link ContractStatus} table and its reason guards
 * - State changes are immutable (a new Contract is returned)
 * - Core commercial fields are frozen once the contract leaves DRAFT
 */
@Value
@Builder(toBuilder = true)
public class Contract {
    UUID id;
    String contractNumber;
    UUID studentId;
    UUID productId;
    String title;
    ContractStatus status;
    BigDecimal totalAmount;
    CurrencyCode currency;
    Integer validityDays;        // null means the contract never expires
    ProductSnapshot productSnapshot;
    Instant signedAt;
    Instant activatedAt;
    Instant suspendedAt;
    String suspendedReason;
    Instant completedAt;
    Instant terminatedAt;
    String terminatedReason;
    Instant expiresAt;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new contract in DRAFT status.
     */
    public static Contract draft(UUID id, String contractNumber, UUID studentId, UUID productId,
                                 String title, BigDecimal totalAmount, CurrencyCode currency,
                                 Integer validityDays, ProductSnapshot productSnapshot,
                                 String createdBy, Instant now) {
        if (studentId == null || productId == null) {
            throw new ValidationException("Student ID and product ID are required");
        }
        validateAmount(totalAmount);
        validateValidityDays(validityDays);
        if (currency == null) {
            throw new ValidationException("Currency is required");
        }
        if (productSnapshot == null || !productSnapshot.hasItems()) {
            throw new ValidationException("Product " + productId + " has no service items");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("createdBy is required");
        }

        return Contract.builder()
            .id(id)
            .contractNumber(contractNumber)
            .studentId(studentId)
            .productId(productId)
            .title(title)
            .status(ContractStatus.DRAFT)
            .totalAmount(totalAmount)
            .currency(currency)
            .validityDays(validityDays)
            .productSnapshot(productSnapshot)
            .createdBy(createdBy)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Moves the contract to {@code target}, applying the timestamps that belong
     * to the new state.
     *
     * @throws InvalidStateTransitionException if the table does not allow the move
     * @throws ValidationException if the target needs a reason and none was given
     */
    public Contract transitionTo(ContractStatus target, String reason, Instant now) {
        if (target == null) {
            throw new ValidationException("Target status is required");
        }
        if (status == ContractStatus.ACTIVE && target == ContractStatus.ACTIVE) {
            throw new InvalidStateTransitionException("Contract " + id + " is already active");
        }
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(
                String.format("Cannot transition contract %s from %s to %s", id, status, target));
        }
        if (ContractStatus.requiresReason(target) && (reason == null || reason.isBlank())) {
            throw new ValidationException("A reason is required to move a contract to " + target);
        }

        ContractBuilder next = toBuilder().status(target).updatedAt(now);
        switch (target) {
            case DRAFT -> next.signedAt(null).expiresAt(null);
            case SIGNED -> next.signedAt(now)
                .expiresAt(validityDays == null ? null : now.plus(Duration.ofDays(validityDays)));
            case ACTIVE -> {
                if (activatedAt == null) {
                    next.activatedAt(now);
                }
                next.suspendedAt(null).suspendedReason(null);
            }
            case SUSPENDED -> next.suspendedAt(now).suspendedReason(reason);
            case COMPLETED -> next.completedAt(now);
            case TERMINATED -> next.terminatedAt(now).terminatedReason(reason);
        }
        return next.build();
    }

    /**
     * True when moving to {@code target} is the contract's first activation,
     * the point at which product entitlements are granted.
     */
    public boolean isFirstActivation(ContractStatus target) {
        return target == ContractStatus.ACTIVE && activatedAt == null;
    }

    /**
     * Applies a core-field update. Only allowed while DRAFT.
     */
    public Contract updateCoreFields(ContractCoreUpdate update, Instant now) {
        if (status != ContractStatus.DRAFT) {
            throw new ContractNotDraftException(id, status);
        }
        if (update == null || update.isEmpty()) {
            throw new ValidationException("No fields to update");
        }

        ContractBuilder next = toBuilder().updatedAt(now);
        if (update.title() != null) {
            next.title(update.title());
        }
        if (update.totalAmount() != null) {
            validateAmount(update.totalAmount());
            next.totalAmount(update.totalAmount());
        }
        if (update.currency() != null) {
            next.currency(update.currency());
        }
        if (update.validityDays() != null) {
            validateValidityDays(update.validityDays());
            next.validityDays(update.validityDays());
        }
        return next.build();
    }

    public boolean isActive() {
        return status == ContractStatus.ACTIVE;
    }

    /**
     * @throws ContractNotActiveException unless the contract is ACTIVE
     */
    public void requireActive() {
        if (!isActive()) {
            throw new ContractNotActiveException(id, status);
        }
    }

    private static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new ValidationException("Contract amount must be positive");
        }
    }

    private static void validateValidityDays(Integer validityDays) {
        if (validityDays != null && validityDays <= 0) {
            throw new ValidationException("Validity days must be positive");
        }
    }
}
