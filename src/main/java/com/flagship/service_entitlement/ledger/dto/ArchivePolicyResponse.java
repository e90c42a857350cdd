package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.ledger.ArchiveScope;
import com.flagship.service_entitlement.ledger.LedgerArchivePolicyEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ArchivePolicyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("scope")
    ArchiveScope scope;

    @JsonProperty("service_type")
    String serviceType;

    @JsonProperty("archive_after_days")
    int archiveAfterDays;

    @JsonProperty("delete_after_archive")
    boolean deleteAfterArchive;

    @JsonProperty("enabled")
    boolean enabled;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ArchivePolicyResponse from(LedgerArchivePolicyEntity policy) {
        return ArchivePolicyResponse.builder()
            .id(policy.getId())
            .scope(policy.getScope())
            .serviceType(policy.getServiceType())
            .archiveAfterDays(policy.getArchiveAfterDays())
            .deleteAfterArchive(policy.isDeleteAfterArchive())
            .enabled(policy.isEnabled())
            .createdBy(policy.getCreatedBy())
            .createdAt(policy.getCreatedAt())
            .updatedAt(policy.getUpdatedAt())
            .build();
    }
}
