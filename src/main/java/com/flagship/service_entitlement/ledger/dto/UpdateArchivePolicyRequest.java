package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;

/**
 * Absent fields stay unchanged. Scope and service type cannot be changed.
 */
public record UpdateArchivePolicyRequest(

        @Positive(message = "archive_after_days must be positive")
        @JsonProperty("archive_after_days")
        Integer archiveAfterDays,

        @JsonProperty("delete_after_archive")
        Boolean deleteAfterArchive,

        @JsonProperty("enabled")
        Boolean enabled) {
}
