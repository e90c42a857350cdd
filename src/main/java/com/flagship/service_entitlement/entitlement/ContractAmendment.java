package com.flagship.service_entitlement.entitlement;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ContractAmendment {
    UUID id;
    UUID studentId;
    UUID contractId;
    String serviceType;
    AmendmentType ledgerType;
    int quantityChanged;
    String reason;
    String description;
    List<String> attachments;
    AmendmentSnapshot snapshot;
    String createdBy;
    Instant createdAt;
}
