package com.flagship.service_entitlement.hold.event;

import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import com.flagship.service_entitlement.hold.ServiceHold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a hold is released, either on request or because its session was completed.
 */
@Value
public class HoldReleasedEvent implements EntitlementEvent {
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

    public static final String EVENT_TYPE = "HoldReleased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldReleasedEvent fromHold(ServiceHold hold) {
        return new HoldReleasedEvent(
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
