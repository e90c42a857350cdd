package com.flagship.service_entitlement.hold.event;

import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import com.flagship.service_entitlement.hold.ServiceHold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a hold passes its expiry time and is closed by the expiry sweep.
 */
@Value
public class HoldExpiredEvent implements EntitlementEvent {
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

    public static final String EVENT_TYPE = "HoldExpired";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldExpiredEvent fromHold(ServiceHold hold) {
        return new HoldExpiredEvent(
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
