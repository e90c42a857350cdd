package com.flagship.service_entitlement.ledger;

import java.util.UUID;

/**
 * Input for {@link LedgerService#recordRefund}. {@code reason} is optional.
 */
public record RefundCommand(
        UUID studentId,
        String serviceType,
        int quantity,
        UUID relatedBookingId,
        String bookingSource,
        String reason,
        String createdBy) {
}
