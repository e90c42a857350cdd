package com.flagship.service_entitlement.contract;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input for {@link ContractService#createContract}. {@code title} and
 * {@code validityDays} are optional.
 */
public record CreateContractCommand(
        UUID studentId,
        UUID productId,
        String title,
        BigDecimal totalAmount,
        CurrencyCode currency,
        Integer validityDays,
        String createdBy) {
}
