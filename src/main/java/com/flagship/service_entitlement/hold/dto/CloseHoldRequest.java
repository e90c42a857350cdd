package com.flagship.service_entitlement.hold.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of a release or cancel call.
 */
public record CloseHoldRequest(

        @JsonProperty("reason")
        String reason,

        @NotBlank(message = "actor is required")
        @JsonProperty("actor")
        String actor) {
}
