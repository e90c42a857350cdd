package com.flagship.service_entitlement.ledger;

import java.util.UUID;

/**
 * The archive settings that apply to one service type after precedence and
 * defaults are resolved. {@code policyId} is null when the configured defaults apply.
 */
public record EffectiveArchivePolicy(UUID policyId, ArchiveScope scope, String serviceType,
                                     int archiveAfterDays, boolean deleteAfterArchive) {
}
