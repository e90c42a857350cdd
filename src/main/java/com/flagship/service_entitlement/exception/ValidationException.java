package com.flagship.service_entitlement.exception;

/**
 * Malformed input: missing reason, non-positive quantity, bad date range and so on.
 */
public class ValidationException extends EntitlementLedgerException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    protected ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
