package com.flagship.service_entitlement.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Merging of live and archive rows for include-archive queries.
 */
class LedgerRepositoryMergeTest {

    private static final UUID STUDENT = UUID.randomUUID();
    private static final Instant T0 = Instant.parse("2025-06-01T00:00:00Z");

    private static LedgerEntry entry(UUID id, Instant createdAt, boolean archived) {
        return LedgerEntry.builder()
            .id(id)
            .studentId(STUDENT)
            .serviceType("mentoring_session")
            .quantity(-1)
            .type(LedgerEntryType.CONSUMPTION)
            .source(LedgerSource.BOOKING_COMPLETED)
            .balanceAfter(4)
            .createdBy("tester")
            .createdAt(createdAt)
            .archived(archived)
            .build();
    }

    @Test
    @DisplayName("orders the union newest first")
    void newestFirst() {
        LedgerEntry oldArchived = entry(UUID.randomUUID(), T0, true);
        LedgerEntry middleLive = entry(UUID.randomUUID(), T0.plusSeconds(60), false);
        LedgerEntry newestLive = entry(UUID.randomUUID(), T0.plusSeconds(120), false);

        List<LedgerEntry> merged = LedgerRepository.merge(List.of(newestLive, middleLive), List.of(oldArchived));

        assertEquals(List.of(newestLive, middleLive, oldArchived), merged);
    }

    @Test
    @DisplayName("a row present in both tables appears once, as its live copy")
    void liveCopyWins() {
        UUID sharedId = UUID.randomUUID();
        LedgerEntry live = entry(sharedId, T0, false);
        LedgerEntry archived = entry(sharedId, T0, true);

        List<LedgerEntry> merged = LedgerRepository.merge(List.of(live), List.of(archived));

        assertEquals(1, merged.size());
        assertFalse(merged.get(0).isArchived());
    }

    @Test
    @DisplayName("empty sides are fine")
    void emptySides() {
        LedgerEntry archived = entry(UUID.randomUUID(), T0, true);

        assertEquals(List.of(archived), LedgerRepository.merge(List.of(), List.of(archived)));
        assertTrue(LedgerRepository.merge(List.of(), List.of()).isEmpty());
    }
}
