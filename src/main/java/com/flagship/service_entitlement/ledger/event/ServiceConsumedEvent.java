package com.flagship.service_entitlement.ledger.event;

import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when units are consumed. One event per consumption, listing every
 * ledger entry it wrote.
 */
@Value
public class ServiceConsumedEvent implements EntitlementEvent {
    UUID eventId;
    UUID studentId;
    String serviceType;
    int quantity;
    int balanceAfter;
    List<UUID> ledgerEntryIds;
    UUID relatedBookingId;
    UUID relatedHoldId;
    UUID contractId;
    String bookingSource;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ServiceConsumed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
