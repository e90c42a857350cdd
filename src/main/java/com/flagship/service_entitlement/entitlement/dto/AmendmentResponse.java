package com.flagship.service_entitlement.entitlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.entitlement.AmendmentType;
import com.flagship.service_entitlement.entitlement.ContractAmendment;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AmendmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("student_id")
    UUID studentId;

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("service_type")
    String serviceType;

    @JsonProperty("ledger_type")
    AmendmentType ledgerType;

    @JsonProperty("quantity_changed")
    int quantityChanged;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("description")
    String description;

    @JsonProperty("attachments")
    List<String> attachments;

    @JsonProperty("contract_number")
    String contractNumber;

    @JsonProperty("contract_status")
    String contractStatus;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AmendmentResponse from(ContractAmendment amendment) {
        AmendmentResponseBuilder builder = AmendmentResponse.builder()
            .id(amendment.getId())
            .studentId(amendment.getStudentId())
            .contractId(amendment.getContractId())
            .serviceType(amendment.getServiceType())
            .ledgerType(amendment.getLedgerType())
            .quantityChanged(amendment.getQuantityChanged())
            .reason(amendment.getReason())
            .description(amendment.getDescription())
            .attachments(amendment.getAttachments())
            .createdBy(amendment.getCreatedBy())
            .createdAt(amendment.getCreatedAt());
        if (amendment.getSnapshot() != null) {
            builder.contractNumber(amendment.getSnapshot().contractNumber())
                .contractStatus(amendment.getSnapshot().contractStatus());
        }
        return builder.build();
    }
}
