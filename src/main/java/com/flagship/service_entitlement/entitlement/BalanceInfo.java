package com.flagship.service_entitlement.entitlement;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Aggregated balance of one (student, service type) key across all its rows.
 */
@Value
public class BalanceInfo {
    UUID studentId;
    String serviceType;
    int totalQuantity;
    int consumedQuantity;
    int heldQuantity;
    int availableQuantity;

    public static BalanceInfo of(UUID studentId, String serviceType, List<EntitlementEntity> rows) {
        int total = 0;
        int consumed = 0;
        int held = 0;
        for (EntitlementEntity row : rows) {
            total += row.getTotalQuantity();
            consumed += row.getConsumedQuantity();
            held += row.getHeldQuantity();
        }
        return new BalanceInfo(studentId, serviceType, total, consumed, held, total - consumed - held);
    }
}
