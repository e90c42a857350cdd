package com.flagship.service_entitlement.ledger.event;

import com.flagship.service_entitlement.entitlement.event.EntitlementEvent;
import com.flagship.service_entitlement.ledger.LedgerEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BalanceAdjustedEvent implements EntitlementEvent {
    UUID eventId;
    UUID ledgerEntryId;
    UUID studentId;
    String serviceType;
    int quantity;
    int balanceAfter;
    String reason;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceAdjusted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceAdjustedEvent fromEntry(LedgerEntry entry) {
        return new BalanceAdjustedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getStudentId(),
            entry.getServiceType(),
            entry.getQuantity(),
            entry.getBalanceAfter(),
            entry.getReason(),
            entry.getCreatedBy(),
            entry.getCreatedAt()
        );
    }
}
