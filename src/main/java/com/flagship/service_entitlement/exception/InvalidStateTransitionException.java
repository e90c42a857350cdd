package com.flagship.service_entitlement.exception;

/**
 * A lifecycle transition that the contract or hold state machine does not allow.
 * Subclasses narrow the cause for callers that care about it.
 */
public class InvalidStateTransitionException extends EntitlementLedgerException {

    public InvalidStateTransitionException(String message) {
        super(ErrorCode.INVALID_STATE_TRANSITION, message);
    }

    protected InvalidStateTransitionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
