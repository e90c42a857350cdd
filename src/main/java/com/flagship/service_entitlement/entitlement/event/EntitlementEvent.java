package com.flagship.service_entitlement.entitlement.event;

import com.flagship.service_entitlement.outbox.DomainEvent;

import java.util.UUID;

/**
 * Events about a student's entitlements: ledger writes, holds and amendments.
 * Published to the entitlement topic keyed by student ID.
 */
public interface EntitlementEvent extends DomainEvent {

    UUID getStudentId();

    String getServiceType();
}
