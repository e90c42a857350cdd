package com.flagship.service_entitlement.hold.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.hold.HoldStatus;
import com.flagship.service_entitlement.hold.ServiceHold;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class HoldResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("student_id")
    UUID studentId;

    @JsonProperty("service_type")
    String serviceType;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("status")
    HoldStatus status;

    @JsonProperty("related_booking_id")
    UUID relatedBookingId;

    @JsonProperty("expiry_at")
    Instant expiryAt;

    @JsonProperty("released_at")
    Instant releasedAt;

    @JsonProperty("release_reason")
    String releaseReason;

    @JsonProperty("released_by")
    String releasedBy;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static HoldResponse from(ServiceHold hold) {
        return HoldResponse.builder()
            .id(hold.getId())
            .contractId(hold.getContractId())
            .studentId(hold.getStudentId())
            .serviceType(hold.getServiceType())
            .quantity(hold.getQuantity())
            .status(hold.getStatus())
            .relatedBookingId(hold.getRelatedBookingId())
            .expiryAt(hold.getExpiryAt())
            .releasedAt(hold.getReleasedAt())
            .releaseReason(hold.getReleaseReason())
            .releasedBy(hold.getReleasedBy())
            .createdBy(hold.getCreatedBy())
            .createdAt(hold.getCreatedAt())
            .updatedAt(hold.getUpdatedAt())
            .build();
    }
}
