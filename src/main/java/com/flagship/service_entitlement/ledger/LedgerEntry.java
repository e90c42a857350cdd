package com.flagship.service_entitlement.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One row of the service ledger. Immutable once written.
 *
 * {@code balanceAfter} is the aggregate available balance of the
 * (student, service type) key right after this entry.
 */
@Value
@Builder
public class LedgerEntry {
    UUID id;
    UUID studentId;
    String serviceType;
    int quantity;
    LedgerEntryType type;
    LedgerSource source;
    int balanceAfter;
    UUID relatedBookingId;
    UUID relatedHoldId;
    Map<String, Object> metadata;
    String reason;
    String createdBy;
    Instant createdAt;
    boolean archived;

    public static LedgerEntry consumption(UUID studentId, String serviceType, int deducted, int balanceAfter,
                                          UUID relatedBookingId, UUID relatedHoldId,
                                          Map<String, Object> metadata, String createdBy, Instant now) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .studentId(studentId)
            .serviceType(serviceType)
            .quantity(-deducted)
            .type(LedgerEntryType.CONSUMPTION)
            .source(LedgerSource.BOOKING_COMPLETED)
            .balanceAfter(balanceAfter)
            .relatedBookingId(relatedBookingId)
            .relatedHoldId(relatedHoldId)
            .metadata(metadata)
            .createdBy(createdBy)
            .createdAt(now)
            .build();
    }

    public static LedgerEntry adjustment(UUID studentId, String serviceType, int delta, int balanceAfter,
                                         String reason, Map<String, Object> metadata, String createdBy,
                                         Instant now) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .studentId(studentId)
            .serviceType(serviceType)
            .quantity(delta)
            .type(LedgerEntryType.ADJUSTMENT)
            .source(LedgerSource.MANUAL_ADJUSTMENT)
            .balanceAfter(balanceAfter)
            .reason(reason)
            .metadata(metadata)
            .createdBy(createdBy)
            .createdAt(now)
            .build();
    }

    public static LedgerEntry refund(UUID studentId, String serviceType, int restored, int balanceAfter,
                                     UUID relatedBookingId, Map<String, Object> metadata, String reason,
                                     String createdBy, Instant now) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .studentId(studentId)
            .serviceType(serviceType)
            .quantity(restored)
            .type(LedgerEntryType.REFUND)
            .source(LedgerSource.BOOKING_CANCELLED)
            .balanceAfter(balanceAfter)
            .relatedBookingId(relatedBookingId)
            .metadata(metadata)
            .reason(reason)
            .createdBy(createdBy)
            .createdAt(now)
            .build();
    }
}
