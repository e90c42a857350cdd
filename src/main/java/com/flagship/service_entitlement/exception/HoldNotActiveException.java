package com.flagship.service_entitlement.exception;

import java.util.UUID;

public class HoldNotActiveException extends InvalidStateTransitionException {

    public HoldNotActiveException(UUID holdId, Enum<?> status) {
        super(ErrorCode.HOLD_NOT_ACTIVE,
                String.format("Service hold %s is %s, expected ACTIVE", holdId, status));
    }
}
