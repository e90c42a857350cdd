package com.flagship.service_entitlement.hold.event;

import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import com.flagship.service_entitlement.hold.ServiceHold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when units are reserved for a booking.
 */
@Value
public class HoldCreatedEvent implements EntitlementEvent {
    UUID eventId;
    UUID holdId;
    UUID contractId;
    UUID studentId;
    String serviceType;
    int quantity;
    UUID relatedBookingId;
    Instant expiryAt;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "HoldCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldCreatedEvent fromHold(ServiceHold hold, Instant occurredAt) {
        return new HoldCreatedEvent(
            UUID.randomUUID(),
            hold.getId(),
            hold.getContractId(),
            hold.getStudentId(),
            hold.getServiceType(),
            hold.getQuantity(),
            hold.getRelatedBookingId(),
            hold.getExpiryAt(),
            hold.getCreatedBy(),
            occurredAt
        );
    }
}
