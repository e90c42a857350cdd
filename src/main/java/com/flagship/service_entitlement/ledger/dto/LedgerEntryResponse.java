package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.ledger.LedgerEntry;
import com.flagship.service_entitlement.ledger.LedgerEntryType;
import com.flagship.service_entitlement.ledger.LedgerSource;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("student_id")
    UUID studentId;

    @JsonProperty("service_type")
    String serviceType;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("type")
    LedgerEntryType type;

    @JsonProperty("source")
    LedgerSource source;

    @JsonProperty("balance_after")
    int balanceAfter;

    @JsonProperty("related_booking_id")
    UUID relatedBookingId;

    @JsonProperty("related_hold_id")
    UUID relatedHoldId;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("archived")
    boolean archived;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .studentId(entry.getStudentId())
            .serviceType(entry.getServiceType())
            .quantity(entry.getQuantity())
            .type(entry.getType())
            .source(entry.getSource())
            .balanceAfter(entry.getBalanceAfter())
            .relatedBookingId(entry.getRelatedBookingId())
            .relatedHoldId(entry.getRelatedHoldId())
            .metadata(entry.getMetadata())
            .reason(entry.getReason())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .archived(entry.isArchived())
            .build();
    }
}
