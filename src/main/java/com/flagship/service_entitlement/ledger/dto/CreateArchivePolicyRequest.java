package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.ledger.ArchiveScope;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreateArchivePolicyRequest(

        @NotNull(message = "Scope is required")
        @JsonProperty("scope")
        ArchiveScope scope,

        @JsonProperty("service_type")
        String serviceType,

        @NotNull(message = "archive_after_days is required")
        @Positive(message = "archive_after_days must be positive")
        @JsonProperty("archive_after_days")
        Integer archiveAfterDays,

        @JsonProperty("delete_after_archive")
        Boolean deleteAfterArchive,

        @JsonProperty("enabled")
        Boolean enabled,

        @NotBlank(message = "created_by is required")
        @JsonProperty("created_by")
        String createdBy) {
}
