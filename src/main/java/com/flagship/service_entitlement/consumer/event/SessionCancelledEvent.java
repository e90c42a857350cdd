package com.flagship.service_entitlement.consumer.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCancelledEvent(
        UUID eventId,
        UUID sessionId,
        UUID studentId,
        UUID holdId,
        String reason,
        String cancelledBy) {

    public static final String EVENT_TYPE = "SessionCancelled";
}
