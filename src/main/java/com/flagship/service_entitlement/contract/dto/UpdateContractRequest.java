package com.flagship.service_entitlement.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Partial update of a DRAFT contract. Absent fields stay unchanged.
 */
public record UpdateContractRequest(

        @JsonProperty("title")
        String title,

        @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
        @JsonProperty("total_amount")
        BigDecimal totalAmount,

        @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
        @JsonProperty("currency")
        String currency,

        @Positive(message = "Validity days must be positive")
        @JsonProperty("validity_days")
        Integer validityDays,

        @NotBlank(message = "updated_by is required")
        @JsonProperty("updated_by")
        String updatedBy) {
}
