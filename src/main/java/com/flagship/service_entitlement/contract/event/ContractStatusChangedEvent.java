package com.flagship.service_entitlement.contract.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every contract status transition, together with the entitlement
 * side effects it caused.
 */
@Value
public class ContractStatusChangedEvent implements ContractEvent {
    UUID eventId;
    UUID contractId;
    UUID studentId;
    String fromStatus;
    String toStatus;
    String reason;
    String changedBy;
    int entitlementsGranted;
    int holdsCancelled;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
