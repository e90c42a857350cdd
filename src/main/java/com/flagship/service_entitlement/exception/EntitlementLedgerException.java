package com.flagship.service_entitlement.exception;

/**
 * Base type for every business failure raised by the entitlement ledger.
 *
 * All checks that can raise one of these run before any write, so a failed
 * operation leaves balances, ledger rows and holds untouched.
 */
public abstract class EntitlementLedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected EntitlementLedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected EntitlementLedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may retry the same request unchanged.
     */
    public boolean isRetryable() {
        return false;
    }
}
