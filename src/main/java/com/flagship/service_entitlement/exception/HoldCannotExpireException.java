package com.flagship.service_entitlement.exception;

import java.util.UUID;

public class HoldCannotExpireException extends InvalidStateTransitionException {

    public HoldCannotExpireException(UUID holdId, String detail) {
        super(ErrorCode.HOLD_CANNOT_EXPIRE,
                String.format("Service hold %s cannot expire: %s", holdId, detail));
    }
}
