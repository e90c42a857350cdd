package com.flagship.service_entitlement.entitlement.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an addon, promotion or compensation grant is added to a contract.
 */
@Value
public class EntitlementAmendedEvent implements EntitlementEvent {
    UUID eventId;
    UUID amendmentId;
    UUID studentId;
    UUID contractId;
    String serviceType;
    String ledgerType;
    int quantityChanged;
    Long entitlementId;
    int balanceAfter;
    String reason;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EntitlementAmended";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
