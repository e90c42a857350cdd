package com.flagship.service_entitlement.ledger;

public enum ArchiveScope {
    GLOBAL,
    SERVICE_TYPE
}
