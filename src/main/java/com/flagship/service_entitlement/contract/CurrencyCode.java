package com.flagship.service_entitlement.contract;

/**
 * ISO-4217 currencies accepted for contract amounts.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    CNY,
    HKD,
    SGD,
    AUD,
    CAD
}
