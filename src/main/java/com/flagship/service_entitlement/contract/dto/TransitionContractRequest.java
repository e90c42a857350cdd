package com.flagship.service_entitlement.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.contract.ContractStatus;
import jakarta.validation.constraints.NotNull;

public record TransitionContractRequest(

        @NotNull(message = "Target status is required")
        @JsonProperty("target_status")
        ContractStatus targetStatus,

        @JsonProperty("reason")
        String reason,

        @JsonProperty("actor_id")
        String actorId) {
}
