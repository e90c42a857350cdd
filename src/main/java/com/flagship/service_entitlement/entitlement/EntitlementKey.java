package com.flagship.service_entitlement.entitlement;

import java.util.UUID;

/**
 * Balance key: entitlement rows aggregate per student and service type.
 */
public record EntitlementKey(UUID studentId, String serviceType) {
}
