package com.flagship.service_entitlement.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.contract.Contract;
import com.flagship.service_entitlement.contract.ContractStatus;
import com.flagship.service_entitlement.contract.ProductItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ContractResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contract_number")
    String contractNumber;

    @JsonProperty("student_id")
    UUID studentId;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("title")
    String title;

    @JsonProperty("status")
    ContractStatus status;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("validity_days")
    Integer validityDays;

    @JsonProperty("service_items")
    List<ServiceItem> serviceItems;

    @JsonProperty("signed_at")
    Instant signedAt;

    @JsonProperty("activated_at")
    Instant activatedAt;

    @JsonProperty("suspended_at")
    Instant suspendedAt;

    @JsonProperty("suspended_reason")
    String suspendedReason;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("terminated_at")
    Instant terminatedAt;

    @JsonProperty("terminated_reason")
    String terminatedReason;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ContractResponse from(Contract contract) {
        return ContractResponse.builder()
            .id(contract.getId())
            .contractNumber(contract.getContractNumber())
            .studentId(contract.getStudentId())
            .productId(contract.getProductId())
            .title(contract.getTitle())
            .status(contract.getStatus())
            .totalAmount(contract.getTotalAmount())
            .currency(contract.getCurrency().name())
            .validityDays(contract.getValidityDays())
            .serviceItems(contract.getProductSnapshot() == null ? List.of()
                : contract.getProductSnapshot().items().stream().map(ServiceItem::from).toList())
            .signedAt(contract.getSignedAt())
            .activatedAt(contract.getActivatedAt())
            .suspendedAt(contract.getSuspendedAt())
            .suspendedReason(contract.getSuspendedReason())
            .completedAt(contract.getCompletedAt())
            .terminatedAt(contract.getTerminatedAt())
            .terminatedReason(contract.getTerminatedReason())
            .expiresAt(contract.getExpiresAt())
            .createdBy(contract.getCreatedBy())
            .createdAt(contract.getCreatedAt())
            .updatedAt(contract.getUpdatedAt())
            .build();
    }

    public record ServiceItem(
            @JsonProperty("service_type") String serviceType,
            @JsonProperty("quantity") int quantity) {

        static ServiceItem from(ProductItem item) {
            return new ServiceItem(item.serviceType(), item.quantity());
        }
    }
}
