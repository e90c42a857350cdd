package com.flagship.service_entitlement.contract;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only lookup of contracts and catalog products used by the ledger.
 */
public interface ContractDirectory {

    /**
     * Loads a contract and keeps it share-locked until the caller's transaction
     * ends, so its status cannot change underneath an entitlement mutation.
     * Must be called inside a transaction.
     */
    Optional<Contract> findContract(UUID contractId);

    /**
     * Service items of a product as currently defined in the catalog.
     * Returns an empty list for unknown products.
     */
    List<ProductItem> listProductItems(UUID productId);
}
