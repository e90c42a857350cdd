package com.flagship.service_entitlement.exception;

/**
 * Stable, machine-readable error codes returned to API clients and recorded
 * for rejected events. The HTTP mapping lives in {@link GlobalExceptionHandler}.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    INVALID_QUANTITY,
    NOT_FOUND,
    INSUFFICIENT_BALANCE,
    EXCEEDS_CONSUMED,
    INVALID_STATE_TRANSITION,
    CONTRACT_NOT_DRAFT,
    CONTRACT_NOT_ACTIVE,
    HOLD_NOT_ACTIVE,
    HOLD_CANNOT_EXPIRE,
    CONFLICT,
    LOCK_TIMEOUT
}
