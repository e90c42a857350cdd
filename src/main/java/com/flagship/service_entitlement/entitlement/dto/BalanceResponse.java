package com.flagship.service_entitlement.entitlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.entitlement.BalanceInfo;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("student_id")
    UUID studentId;

    @JsonProperty("service_type")
    String serviceType;

    @JsonProperty("total_quantity")
    int totalQuantity;

    @JsonProperty("consumed_quantity")
    int consumedQuantity;

    @JsonProperty("held_quantity")
    int heldQuantity;

    @JsonProperty("available_quantity")
    int availableQuantity;

    public static BalanceResponse from(BalanceInfo balance) {
        return BalanceResponse.builder()
            .studentId(balance.getStudentId())
            .serviceType(balance.getServiceType())
            .totalQuantity(balance.getTotalQuantity())
            .consumedQuantity(balance.getConsumedQuantity())
            .heldQuantity(balance.getHeldQuantity())
            .availableQuantity(balance.getAvailableQuantity())
            .build();
    }
}
