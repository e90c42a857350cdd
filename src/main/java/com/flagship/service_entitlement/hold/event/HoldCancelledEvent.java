package com.flagship.service_entitlement.hold.event;

import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import com.flagship.service_entitlement.hold.ServiceHold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a hold is cancelled and its units returned.
 */
@Value
public class HoldCancelledEvent implements EntitlementEvent {
    UUID eventId;
    UUID holdId;
    UUID contractId;
    UUID studentId;
    String serviceType;
    int quantity;
    UUID relatedBookingId;
    String reason;
    String actor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "HoldCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldCancelledEvent fromHold(ServiceHold hold) {
        return new HoldCancelledEvent(
            UUID.randomUUID(),
            hold.getId(),
            hold.getContractId(),
            hold.getStudentId(),
            hold.getServiceType(),
            hold.getQuantity(),
            hold.getRelatedBookingId(),
            hold.getReleaseReason(),
            hold.getReleasedBy(),
            hold.getReleasedAt()
        );
    }
}
