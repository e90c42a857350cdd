package com.flagship.service_entitlement.ledger;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger query criteria. Null fields do not filter; {@code from} is inclusive
 * and {@code to} exclusive.
 */
public record LedgerFilter(UUID studentId, String serviceType, Instant from, Instant to) {

    public LedgerFilter withRange(Instant newFrom, Instant newTo) {
        return new LedgerFilter(studentId, serviceType, newFrom, newTo);
    }
}
