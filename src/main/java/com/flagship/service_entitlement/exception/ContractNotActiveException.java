package com.flagship.service_entitlement.exception;

import java.util.UUID;

public class ContractNotActiveException extends InvalidStateTransitionException {

    public ContractNotActiveException(UUID contractId, Enum<?> status) {
        super(ErrorCode.CONTRACT_NOT_ACTIVE,
                String.format("Contract %s is %s, expected ACTIVE", contractId, status));
    }
}
