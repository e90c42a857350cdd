package com.flagship.service_entitlement.exception;

public class InsufficientBalanceException extends EntitlementLedgerException {

    private final int available;
    private final int requested;

    public InsufficientBalanceException(String serviceType, int available, int requested) {
        super(ErrorCode.INSUFFICIENT_BALANCE, String.format(
                "Insufficient balance for %s: available=%d, requested=%d", serviceType, available, requested));
        this.available = available;
        this.requested = requested;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequested() {
        return requested;
    }
}
