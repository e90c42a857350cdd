package com.flagship.service_entitlement.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Figures behind one reconciliation verdict. Adjustments are reported for
 * reference only; they take no part in the comparison.
 */
@Value
@Builder
public class ReconciliationReport {
    UUID studentId;
    String serviceType;
    int ledgerConsumed;
    int ledgerRefunded;
    int netLedgerConsumed;
    int entitlementConsumed;
    int adjustmentTotal;
    boolean balanced;
    Instant checkedAt;

    /**
     * Net ledger consumption minus the consumed quantity on the entitlement rows.
     */
    public int getDifference() {
        return netLedgerConsumed - entitlementConsumed;
    }
}
