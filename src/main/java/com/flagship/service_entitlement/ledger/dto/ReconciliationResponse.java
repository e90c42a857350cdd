package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.ledger.ReconciliationReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("student_id")
    UUID studentId;

    @JsonProperty("service_type")
    String serviceType;

    @JsonProperty("balanced")
    boolean balanced;

    @JsonProperty("ledger_consumed")
    int ledgerConsumed;

    @JsonProperty("ledger_refunded")
    int ledgerRefunded;

    @JsonProperty("net_ledger_consumed")
    int netLedgerConsumed;

    @JsonProperty("entitlement_consumed")
    int entitlementConsumed;

    @JsonProperty("adjustment_total")
    int adjustmentTotal;

    @JsonProperty("difference")
    int difference;

    @JsonProperty("checked_at")
    Instant checkedAt;

    public static ReconciliationResponse from(ReconciliationReport report) {
        return ReconciliationResponse.builder()
            .studentId(report.getStudentId())
            .serviceType(report.getServiceType())
            .balanced(report.isBalanced())
            .ledgerConsumed(report.getLedgerConsumed())
            .ledgerRefunded(report.getLedgerRefunded())
            .netLedgerConsumed(report.getNetLedgerConsumed())
            .entitlementConsumed(report.getEntitlementConsumed())
            .adjustmentTotal(report.getAdjustmentTotal())
            .difference(report.getDifference())
            .checkedAt(report.getCheckedAt())
            .build();
    }
}
