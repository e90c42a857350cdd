package com.flagship.service_entitlement.hold.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

public record CreateHoldRequest(

        @NotNull(message = "Contract ID is required")
        @JsonProperty("contract_id")
        UUID contractId,

        @NotNull(message = "Student ID is required")
        @JsonProperty("student_id")
        UUID studentId,

        @NotBlank(message = "Service type is required")
        @JsonProperty("service_type")
        String serviceType,

        @NotNull(message = "Quantity is required")
        @JsonProperty("quantity")
        Integer quantity,

        @JsonProperty("related_booking_id")
        UUID relatedBookingId,

        @JsonProperty("expiry_at")
        Instant expiryAt,

        @NotBlank(message = "created_by is required")
        @JsonProperty("created_by")
        String createdBy) {
}
