package com.flagship.service_entitlement.hold;

import com.flagship.service_entitlement.exception.HoldCannotExpireException;
import com.flagship.service_entitlement.exception.HoldNotActiveException;
import com.flagship.service_entitlement.exception.InvalidQuantityException;
import com.flagship.service_entitlement.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A reservation of entitlement units, typically for a booked but not yet
 * delivered session.
 *
 * Terminal transitions return a new instance; the row is kept for audit.
 * The held units themselves live on the entitlement rows and are returned by
 * {@link HoldService} in the same transaction as the transition.
 */
@Value
@Builder(toBuilder = true)
public class ServiceHold {

    public static final String REASON_COMPLETED = "completed";
    public static final String REASON_EXPIRED = "expired";

    UUID id;
    UUID contractId;
    UUID studentId;
    String serviceType;
    int quantity;
    HoldStatus status;
    UUID relatedBookingId;
    Instant expiryAt;            // null means the hold never expires on its own
    Instant releasedAt;
    String releaseReason;
    String releasedBy;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    public static ServiceHold create(UUID id, UUID contractId, UUID studentId, String serviceType, int quantity,
                                     UUID relatedBookingId, Instant expiryAt, String createdBy, Instant now) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
        if (contractId == null || studentId == null) {
            throw new ValidationException("Contract ID and student ID are required");
        }
        if (serviceType == null || serviceType.isBlank()) {
            throw new ValidationException("Service type is required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("createdBy is required");
        }

        return ServiceHold.builder()
            .id(id)
            .contractId(contractId)
            .studentId(studentId)
            .serviceType(serviceType)
            .quantity(quantity)
            .status(HoldStatus.ACTIVE)
            .relatedBookingId(relatedBookingId)
            .expiryAt(expiryAt)
            .createdBy(createdBy)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public ServiceHold release(String reason, String releasedBy, Instant now) {
        return close(HoldStatus.RELEASED, reason, releasedBy, now);
    }

    public ServiceHold cancel(String reason, String cancelledBy, Instant now) {
        return close(HoldStatus.CANCELLED, reason, cancelledBy, now);
    }

    /**
     * @throws HoldNotActiveException if the hold is already closed
     * @throws HoldCannotExpireException if it has no expiry time or the time has not come
     */
    public ServiceHold markAsExpired(Instant now) {
        requireActive();
        if (expiryAt == null) {
            throw new HoldCannotExpireException(id, "no expiry time is set");
        }
        if (expiryAt.isAfter(now)) {
            throw new HoldCannotExpireException(id, "expiry time " + expiryAt + " has not been reached");
        }
        return close(HoldStatus.EXPIRED, REASON_EXPIRED, null, now);
    }

    public boolean isActive() {
        return status == HoldStatus.ACTIVE;
    }

    public boolean isDue(Instant now) {
        return isActive() && expiryAt != null && !expiryAt.isAfter(now);
    }

    private ServiceHold close(HoldStatus target, String reason, String actor, Instant now) {
        requireActive();
        if (!status.canTransitionTo(target)) {
            throw new HoldNotActiveException(id, status);
        }
        return toBuilder()
            .status(target)
            .releasedAt(now)
            .releaseReason(reason)
            .releasedBy(actor)
            .updatedAt(now)
            .build();
    }

    private void requireActive() {
        if (!isActive()) {
            throw new HoldNotActiveException(id, status);
        }
    }
}
