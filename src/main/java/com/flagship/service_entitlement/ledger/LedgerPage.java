package com.flagship.service_entitlement.ledger;

/**
 * Paging and partition selection for ledger queries.
 */
public record LedgerPage(boolean includeArchive, int limit, int offset) {
}
