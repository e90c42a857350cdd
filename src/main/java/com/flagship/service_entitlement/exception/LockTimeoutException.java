package com.flagship.service_entitlement.exception;

/**
 * Row locks on a contract, an entitlement key or a hold could not be acquired
 * within the configured lock timeout, or the database chose this transaction
 * as a deadlock victim.
 */
public class LockTimeoutException extends EntitlementLedgerException {

    public LockTimeoutException(String message, Throwable cause) {
        super(ErrorCode.LOCK_TIMEOUT, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
