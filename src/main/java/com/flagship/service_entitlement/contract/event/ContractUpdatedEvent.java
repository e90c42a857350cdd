package com.flagship.service_entitlement.contract.event;

import com.flagship.service_entitlement.contract.Contract;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when the core fields of a DRAFT contract change.
 */
@Value
public class ContractUpdatedEvent implements ContractEvent {
    UUID eventId;
    UUID contractId;
    String title;
    BigDecimal totalAmount;
    String currency;
    Integer validityDays;
    String updatedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContractUpdatedEvent fromContract(Contract contract, String updatedBy) {
        return new ContractUpdatedEvent(
            UUID.randomUUID(),
            contract.getId(),
            contract.getTitle(),
            contract.getTotalAmount(),
            contract.getCurrency().name(),
            contract.getValidityDays(),
            updatedBy,
            contract.getUpdatedAt()
        );
    }
}
