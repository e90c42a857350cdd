package com.flagship.service_entitlement.consumer.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

/**
 * The contract's payment cleared; the contract becomes ACTIVE.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentSucceededEvent(
        UUID eventId,
        UUID contractId,
        UUID paymentId) {

    public static final String EVENT_TYPE = "PaymentSucceeded";
}
