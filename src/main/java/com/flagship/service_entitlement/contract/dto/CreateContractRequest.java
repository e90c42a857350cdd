package com.flagship.service_entitlement.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.UUID;

public record CreateContractRequest(

        @NotNull(message = "Student ID is required")
        @JsonProperty("student_id")
        UUID studentId,

        @NotNull(message = "Product ID is required")
        @JsonProperty("product_id")
        UUID productId,

        @JsonProperty("title")
        String title,

        @NotNull(message = "Total amount is required")
        @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
        @JsonProperty("total_amount")
        BigDecimal totalAmount,

        @NotBlank(message = "Currency is required")
        @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
        @JsonProperty("currency")
        String currency,

        @Positive(message = "Validity days must be positive")
        @JsonProperty("validity_days")
        Integer validityDays,

        @NotBlank(message = "created_by is required")
        @JsonProperty("created_by")
        String createdBy) {
}
