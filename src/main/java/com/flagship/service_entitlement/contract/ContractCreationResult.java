package com.flagship.service_entitlement.contract;

/**
 * Outcome of an idempotent create: {@code created} is false when the
 * Idempotency-Key had already been used and the earlier contract is returned.
 */
public record ContractCreationResult(Contract contract, boolean created) {
}
