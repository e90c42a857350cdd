package com.flagship.service_entitlement.contract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable copy of a product's service items taken when the contract is created,
 * so later catalog edits never change what a signed contract grants.
 */
public record ProductSnapshot(UUID productId, List<ProductItem> items) {

    public ProductSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ProductSnapshot of(UUID productId, List<ProductItem> items) {
        return new ProductSnapshot(productId, items);
    }

    public boolean hasItems() {
        return !items.isEmpty();
    }

    /**
     * Quantities summed per service type, in first-seen order.
     */
    public Map<String, Integer> quantitiesByServiceType() {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (ProductItem item : items) {
            totals.merge(item.serviceType(), item.quantity(), Integer::sum);
        }
        return totals;
    }
}
