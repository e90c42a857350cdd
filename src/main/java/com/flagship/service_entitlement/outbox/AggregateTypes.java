package com.flagship.service_entitlement.outbox;

/**
 * Aggregate types written to the outbox. The aggregate ID becomes the Kafka key,
 * so all events of one aggregate land on one partition in order.
 */
public final class AggregateTypes {

    /** Keyed by contract ID. */
    public static final String CONTRACT = "Contract";

    /** Keyed by student ID: ledger, hold and amendment events of one student stay ordered. */
    public static final String STUDENT_ENTITLEMENT = "StudentEntitlement";

    private AggregateTypes() {
    }
}
