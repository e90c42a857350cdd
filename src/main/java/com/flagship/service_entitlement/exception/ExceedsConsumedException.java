package com.flagship.service_entitlement.exception;

public class ExceedsConsumedException extends EntitlementLedgerException {

    private final int netConsumed;
    private final int requested;

    public ExceedsConsumedException(String serviceType, int netConsumed, int requested) {
        super(ErrorCode.EXCEEDS_CONSUMED, String.format(
                "Refund exceeds consumed quantity for %s: refundable=%d, requested=%d",
                serviceType, netConsumed, requested));
        this.netConsumed = netConsumed;
        this.requested = requested;
    }

    public int getNetConsumed() {
        return netConsumed;
    }

    public int getRequested() {
        return requested;
    }
}
