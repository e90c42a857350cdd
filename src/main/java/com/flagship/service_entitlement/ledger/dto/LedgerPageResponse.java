package com.flagship.service_entitlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LedgerPageResponse {

    @JsonProperty("entries")
    List<LedgerEntryResponse> entries;

    @JsonProperty("include_archive")
    boolean includeArchive;

    @JsonProperty("limit")
    Integer limit;

    @JsonProperty("offset")
    Integer offset;
}
