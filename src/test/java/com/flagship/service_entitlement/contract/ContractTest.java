package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.exception.ContractNotActiveException;
import com.flagship.service_entitlement.exception.ContractNotDraftException;
import com.flagship.service_entitlement.exception.InvalidStateTransitionException;
import com.flagship.service_entitlement.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ContractTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private ProductSnapshot snapshot;
    private Contract draft;

    @BeforeEach
    void setUp() {
        UUID productId = UUID.randomUUID();
        snapshot = ProductSnapshot.of(productId, List.of(
            new ProductItem("mentoring_session", 10),
            new ProductItem("essay_review", 2),
            new ProductItem("mentoring_session", 2)));
        draft = Contract.draft(UUID.randomUUID(), "CT-20260301-0001", UUID.randomUUID(), productId,
            "Premium package", new BigDecimal("1200.00"), CurrencyCode.USD, 30, snapshot, "advisor", NOW);
    }

    private Contract activate(Contract contract) {
        return contract.transitionTo(ContractStatus.SIGNED, null, NOW)
            .transitionTo(ContractStatus.ACTIVE, null, NOW.plusSeconds(60));
    }

    @Nested
    @DisplayName("draft")
    class Draft {

        @Test
        @DisplayName("starts in DRAFT with no lifecycle timestamps")
        void startsInDraft() {
            assertEquals(ContractStatus.DRAFT, draft.getStatus());
            assertNull(draft.getSignedAt());
            assertNull(draft.getActivatedAt());
            assertEquals(NOW, draft.getCreatedAt());
        }

        @Test
        @DisplayName("requires a product with service items")
        void requiresItems() {
            ProductSnapshot empty = ProductSnapshot.of(UUID.randomUUID(), List.of());

            assertThrows(ValidationException.class, () -> Contract.draft(UUID.randomUUID(), "CT-1",
                UUID.randomUUID(), empty.productId(), null, BigDecimal.TEN, CurrencyCode.USD, null, empty,
                "advisor", NOW));
        }

        @Test
        @DisplayName("rejects a non-positive amount")
        void rejectsAmount() {
            assertThrows(ValidationException.class, () -> Contract.draft(UUID.randomUUID(), "CT-1",
                UUID.randomUUID(), snapshot.productId(), null, BigDecimal.ZERO, CurrencyCode.USD, null, snapshot,
                "advisor", NOW));
        }
    }

    @Nested
    @DisplayName("transitionTo")
    class TransitionTo {

        @Test
        @DisplayName("signing sets signedAt and the expiry from validity days")
        void signing() {
            Contract signed = draft.transitionTo(ContractStatus.SIGNED, null, NOW);

            assertEquals(NOW, signed.getSignedAt());
            assertEquals(NOW.plus(Duration.ofDays(30)), signed.getExpiresAt());
            assertEquals(ContractStatus.DRAFT, draft.getStatus(), "original is unchanged");
        }

        @Test
        @DisplayName("back to DRAFT clears the signature")
        void unsign() {
            Contract back = draft.transitionTo(ContractStatus.SIGNED, null, NOW)
                .transitionTo(ContractStatus.DRAFT, null, NOW);

            assertNull(back.getSignedAt());
            assertNull(back.getExpiresAt());
        }

        @Test
        @DisplayName("first activation is detected only once")
        void firstActivation() {
            Contract signed = draft.transitionTo(ContractStatus.SIGNED, null, NOW);
            assertTrue(signed.isFirstActivation(ContractStatus.ACTIVE));

            Contract suspended = activate(draft).transitionTo(ContractStatus.SUSPENDED, "payment overdue", NOW);
            assertFalse(suspended.isFirstActivation(ContractStatus.ACTIVE));

            Contract resumed = suspended.transitionTo(ContractStatus.ACTIVE, null, NOW.plusSeconds(120));
            assertEquals(NOW.plusSeconds(60), resumed.getActivatedAt(), "activatedAt keeps the first activation");
            assertNull(resumed.getSuspendedAt());
            assertNull(resumed.getSuspendedReason());
        }

        @Test
        @DisplayName("DRAFT cannot jump to ACTIVE")
        void skipSigning() {
            assertThrows(InvalidStateTransitionException.class,
                () -> draft.transitionTo(ContractStatus.ACTIVE, null, NOW));
        }

        @Test
        @DisplayName("ACTIVE to ACTIVE is rejected")
        void alreadyActive() {
            Contract active = activate(draft);

            assertThrows(InvalidStateTransitionException.class,
                () -> active.transitionTo(ContractStatus.ACTIVE, null, NOW));
        }

        @Test
        @DisplayName("suspension without a reason is rejected")
        void suspendNeedsReason() {
            Contract active = activate(draft);

            assertThrows(ValidationException.class,
                () -> active.transitionTo(ContractStatus.SUSPENDED, " ", NOW));
        }

        @Test
        @DisplayName("termination records the reason")
        void terminate() {
            Contract terminated = activate(draft).transitionTo(ContractStatus.TERMINATED, "refund requested", NOW);

            assertEquals(ContractStatus.TERMINATED, terminated.getStatus());
            assertEquals("refund requested", terminated.getTerminatedReason());
            assertEquals(NOW, terminated.getTerminatedAt());
            assertThrows(InvalidStateTransitionException.class,
                () -> terminated.transitionTo(ContractStatus.ACTIVE, null, NOW));
        }
    }

    @Nested
    @DisplayName("updateCoreFields")
    class UpdateCoreFields {

        @Test
        @DisplayName("changes only the given fields while DRAFT")
        void partialUpdate() {
            Contract updated = draft.updateCoreFields(
                new ContractCoreUpdate(null, new BigDecimal("999.00"), CurrencyCode.EUR, null), NOW);

            assertEquals(new BigDecimal("999.00"), updated.getTotalAmount());
            assertEquals(CurrencyCode.EUR, updated.getCurrency());
            assertEquals("Premium package", updated.getTitle());
            assertEquals(30, updated.getValidityDays());
        }

        @Test
        @DisplayName("is frozen after signing")
        void frozenAfterSigning() {
            Contract signed = draft.transitionTo(ContractStatus.SIGNED, null, NOW);

            assertThrows(ContractNotDraftException.class,
                () -> signed.updateCoreFields(new ContractCoreUpdate("New title", null, null, null), NOW));
        }

        @Test
        @DisplayName("an empty update is rejected")
        void emptyUpdate() {
            assertThrows(ValidationException.class,
                () -> draft.updateCoreFields(new ContractCoreUpdate(null, null, null, null), NOW));
        }
    }

    @Test
    @DisplayName("requireActive guards every state but ACTIVE")
    void requireActive() {
        assertThrows(ContractNotActiveException.class, draft::requireActive);
        assertDoesNotThrow(() -> activate(draft).requireActive());
    }

    @Test
    @DisplayName("snapshot sums quantities per service type")
    void snapshotTotals() {
        assertEquals(12, snapshot.quantitiesByServiceType().get("mentoring_session"));
        assertEquals(2, snapshot.quantitiesByServiceType().get("essay_review"));
    }
}
