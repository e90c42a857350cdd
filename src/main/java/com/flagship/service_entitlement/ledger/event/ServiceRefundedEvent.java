package com.flagship.service_entitlement.ledger.event;

import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import com.flagship.service_entitlement.ledger.LedgerEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ServiceRefundedEvent implements EntitlementEvent {
    UUID eventId;
    UUID ledgerEntryId;
    UUID studentId;
    String serviceType;
    int quantity;
    int balanceAfter;
    UUID relatedBookingId;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ServiceRefunded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ServiceRefundedEvent fromEntry(LedgerEntry entry) {
        return new ServiceRefundedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getStudentId(),
            entry.getServiceType(),
            entry.getQuantity(),
            entry.getBalanceAfter(),
            entry.getRelatedBookingId(),
            entry.getCreatedBy(),
            entry.getCreatedAt()
        );
    }
}
