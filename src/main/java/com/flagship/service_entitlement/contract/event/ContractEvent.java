package com.flagship.service_entitlement.contract.event;

import com.flagship.service_entitlement.outbox.DomainEvent;

import java.util.UUID;

/**
 * Contract lifecycle events, published to the contract topic keyed by contract ID.
 */
public interface ContractEvent extends DomainEvent {

    /**
     * The contract this event is about.
     */
    UUID getContractId();
}
