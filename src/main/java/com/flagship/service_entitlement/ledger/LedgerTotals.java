package com.flagship.service_entitlement.ledger;

/**
 * Sums over every ledger entry of a key, live and archived.
 * {@code consumed} is the absolute value of the consumption entries.
 */
public record LedgerTotals(int consumed, int refunded, int adjusted) {

    /**
     * Units consumed and not yet refunded.
     */
    public int netConsumed() {
        return consumed - refunded;
    }
}
