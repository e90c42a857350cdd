package com.flagship.service_entitlement.exception;

import java.util.UUID;

public class NotFoundException extends EntitlementLedgerException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException contract(UUID contractId) {
        return new NotFoundException("Contract not found: " + contractId);
    }

    public static NotFoundException hold(UUID holdId) {
        return new NotFoundException("Service hold not found: " + holdId);
    }

    public static NotFoundException entitlements(UUID studentId, String serviceType) {
        return new NotFoundException(String.format(
                "No entitlements found for student %s and service type %s", studentId, serviceType));
    }

    public static NotFoundException archivePolicy(UUID policyId) {
        return new NotFoundException("Archive policy not found: " + policyId);
    }
}
