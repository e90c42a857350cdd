package com.flagship.service_entitlement.entitlement;

import java.util.UUID;

/**
 * The contract an amendment was granted against, as it was at grant time.
 */
public record AmendmentSnapshot(UUID contractId, String contractNumber, String contractStatus) {
}
