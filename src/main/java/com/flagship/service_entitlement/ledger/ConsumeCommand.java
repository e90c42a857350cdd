package com.flagship.service_entitlement.ledger;

import java.util.UUID;

/**
 * Input for {@link LedgerService#recordConsumption}.
 *
 * @param relatedBookingId when set, {@code bookingSource} is required and stored in the entry metadata
 * @param relatedHoldId    hold to close as part of the consumption
 * @param contractId       when set, the contract must be ACTIVE and owned by the student
 */
public record ConsumeCommand(
        UUID studentId,
        String serviceType,
        int quantity,
        UUID relatedBookingId,
        String bookingSource,
        UUID relatedHoldId,
        UUID contractId,
        String createdBy) {
}
