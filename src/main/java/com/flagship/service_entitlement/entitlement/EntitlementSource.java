package com.flagship.service_entitlement.entitlement;

/**
 * Where an entitlement row came from. PRODUCT rows are granted on first contract
 * activation; the others are written by amendments.
 */
public enum EntitlementSource {
    PRODUCT,
    ADDON,
    PROMOTION,
    COMPENSATION
}
