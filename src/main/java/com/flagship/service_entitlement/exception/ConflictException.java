package com.flagship.service_entitlement.exception;

public class ConflictException extends EntitlementLedgerException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
