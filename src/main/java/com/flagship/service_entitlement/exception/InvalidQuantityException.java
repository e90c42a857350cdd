package com.flagship.service_entitlement.exception;

public class InvalidQuantityException extends ValidationException {

    public InvalidQuantityException(int quantity) {
        super(ErrorCode.INVALID_QUANTITY,
                String.format("Quantity must be greater than 0, got %d", quantity));
    }
}
