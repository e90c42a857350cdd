package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record RefundRequest(

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

        @JsonProperty("booking_source")
        String bookingSource,

        @JsonProperty("reason")
        String reason,

        @NotBlank(message = "created_by is required")
        @JsonProperty("created_by")
        String createdBy) {
}
