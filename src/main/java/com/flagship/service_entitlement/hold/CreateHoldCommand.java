package com.flagship.service_entitlement.hold;

import java.time.Instant;
import java.util.UUID;

/**
 * Input for {@link HoldService#createHold}. {@code relatedBookingId} and
 * {@code expiryAt} are optional.
 */
public record CreateHoldCommand(
        UUID contractId,
        UUID studentId,
        String serviceType,
        int quantity,
        UUID relatedBookingId,
        Instant expiryAt,
        String createdBy) {
}
