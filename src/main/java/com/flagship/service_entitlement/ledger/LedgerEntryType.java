package com.flagship.service_entitlement.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of ledger entry. Stored lowercase in service_ledgers.type.
 *
 * Consumption entries carry negative quantities, refunds positive ones and
 * adjustments either sign.
 */
public enum LedgerEntryType {
    CONSUMPTION("consumption"),
    ADJUSTMENT("adjustment"),
    REFUND("refund");

    private final String dbValue;

    LedgerEntryType(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static LedgerEntryType fromDbValue(String value) {
        for (LedgerEntryType type : values()) {
            if (type.dbValue.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ledger entry type: " + value);
    }
}
