package com.flagship.service_entitlement.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What caused a ledger entry. Stored lowercase in service_ledgers.source.
 */
public enum LedgerSource {
    BOOKING_COMPLETED("booking_completed"),
    MANUAL_ADJUSTMENT("manual_adjustment"),
    BOOKING_CANCELLED("booking_cancelled");

    private final String dbValue;

    LedgerSource(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static LedgerSource fromDbValue(String value) {
        for (LedgerSource source : values()) {
            if (source.dbValue.equals(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown ledger source: " + value);
    }
}
