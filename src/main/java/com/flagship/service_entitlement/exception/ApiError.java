package com.flagship.service_entitlement.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    ErrorCode code;
    String message;
    Map<String, String> details;
    Boolean retryable;
    Instant timestamp;
}
