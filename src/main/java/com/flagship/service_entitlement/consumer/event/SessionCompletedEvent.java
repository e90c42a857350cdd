package com.flagship.service_entitlement.consumer.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

/**
 * A booked session was delivered. One unit of {@code serviceType} is consumed
 * with the session as the related booking.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCompletedEvent(
        UUID eventId,
        UUID sessionId,
        UUID studentId,
        String serviceType,
        UUID contractId,
        UUID holdId,
        String bookingSource,
        String createdBy) {

    public static final String EVENT_TYPE = "SessionCompleted";
}
