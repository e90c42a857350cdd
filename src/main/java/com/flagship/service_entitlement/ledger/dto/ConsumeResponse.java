package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.service_entitlement.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A consumption may span several entitlement rows; one entry is written per row touched.
 */
@Value
@Builder
public class ConsumeResponse {

    @JsonProperty("entries")
    List<LedgerEntryResponse> entries;

    @JsonProperty("balance_after")
    int balanceAfter;

    public static ConsumeResponse from(List<LedgerEntry> entries) {
        return ConsumeResponse.builder()
            .entries(entries.stream().map(LedgerEntryResponse::from).toList())
            .balanceAfter(entries.isEmpty() ? 0 : entries.get(entries.size() - 1).getBalanceAfter())
            .build();
    }
}
