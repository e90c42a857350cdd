package com.flagship.service_entitlement.ledger;

/**
 * Input for creating an archive policy. {@code serviceType} is required for the
 * SERVICE_TYPE scope and must be absent for GLOBAL.
 */
public record ArchivePolicyCommand(
        ArchiveScope scope,
        String serviceType,
        int archiveAfterDays,
        boolean deleteAfterArchive,
        boolean enabled,
        String createdBy) {
}
