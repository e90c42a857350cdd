package com.flagship.service_entitlement.exception;

import java.util.UUID;

public class ContractNotDraftException extends InvalidStateTransitionException {

    public ContractNotDraftException(UUID contractId, Enum<?> status) {
        super(ErrorCode.CONTRACT_NOT_DRAFT, String.format(
                "Contract %s is %s; core fields can only be changed while DRAFT", contractId, status));
    }
}
