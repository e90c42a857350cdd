package com.flagship.service_entitlement.contract.event;

import com.flagship.service_entitlement.contract.Contract;
import com.flagship.service_entitlement.contract.ProductSnapshot;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a DRAFT contract is created.
 */
@Value
public class ContractCreatedEvent implements ContractEvent {
    UUID eventId;
    UUID contractId;
    String contractNumber;
    UUID studentId;
    UUID productId;
    BigDecimal totalAmount;
    String currency;
    Integer validityDays;
    ProductSnapshot productSnapshot;
    String status;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContractCreatedEvent fromContract(Contract contract) {
        return new ContractCreatedEvent(
            UUID.randomUUID(),
            contract.getId(),
            contract.getContractNumber(),
            contract.getStudentId(),
            contract.getProductId(),
            contract.getTotalAmount(),
            contract.getCurrency().name(),
            contract.getValidityDays(),
            contract.getProductSnapshot(),
            contract.getStatus().name(),
            contract.getCreatedBy(),
            contract.getCreatedAt()
        );
    }
}
