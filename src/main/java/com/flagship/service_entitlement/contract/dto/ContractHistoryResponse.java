package com.flagship.service_entitlement.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.contract.ContractStatus;
import com.flagship.service_entitlement.contract.ContractStatusHistory;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class ContractHistoryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_status")
    ContractStatus fromStatus;

    @JsonProperty("to_status")
    ContractStatus toStatus;

    @JsonProperty("changed_at")
    Instant changedAt;

    @JsonProperty("changed_by")
    String changedBy;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    public static ContractHistoryResponse from(ContractStatusHistory history) {
        return ContractHistoryResponse.builder()
            .id(history.getId())
            .fromStatus(history.getFromStatus())
            .toStatus(history.getToStatus())
            .changedAt(history.getChangedAt())
            .changedBy(history.getChangedBy())
            .reason(history.getReason())
            .metadata(history.getMetadata())
            .build();
    }
}
