package com.flagship.service_entitlement.contract;

/**
 * One service line of a purchasable product: {@code quantity} units of {@code serviceType}.
 */
public record ProductItem(String serviceType, int quantity) {
}
