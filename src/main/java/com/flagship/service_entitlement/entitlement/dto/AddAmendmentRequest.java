package com.flagship.service_entitlement.entitlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.entitlement.AmendmentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.UUID;

public record AddAmendmentRequest(

        @NotNull(message = "Student ID is required")
        @JsonProperty("student_id")
        UUID studentId,

        @NotBlank(message = "Service type is required")
        @JsonProperty("service_type")
        String serviceType,

        @NotNull(message = "Ledger type is required")
        @JsonProperty("ledger_type")
        AmendmentType ledgerType,

        @NotNull(message = "Quantity is required")
        @Positive(message = "Quantity must be positive")
        @JsonProperty("quantity_changed")
        Integer quantityChanged,

        @NotBlank(message = "Reason is required")
        @JsonProperty("reason")
        String reason,

        @JsonProperty("description")
        String description,

        @JsonProperty("attachments")
        List<String> attachments,

        @NotBlank(message = "created_by is required")
        @JsonProperty("created_by")
        String createdBy) {
}
