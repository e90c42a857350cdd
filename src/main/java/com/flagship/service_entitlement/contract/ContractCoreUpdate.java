package com.flagship.service_entitlement.contract;

import java.math.BigDecimal;

/**
 * Partial update of the fields that are frozen once a contract leaves DRAFT.
 * Null means "leave unchanged".
 */
public record ContractCoreUpdate(String title, BigDecimal totalAmount, CurrencyCode currency, Integer validityDays) {

    public boolean isEmpty() {
        return title == null && totalAmount == null && currency == null && validityDays == null;
    }
}
