package com.flagship.service_entitlement.contract;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One recorded status change. {@code fromStatus} is null for the creation entry.
 */
@Value
public class ContractStatusHistory {
    UUID id;
    UUID contractId;
    ContractStatus fromStatus;
    ContractStatus toStatus;
    Instant changedAt;
    String changedBy;
    String reason;
    Map<String, Object> metadata;
}
