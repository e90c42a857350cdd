package com.flagship.service_entitlement.hold;

import com.flagship.service_entitlement.exception.HoldCannotExpireException;
import com.flagship.service_entitlement.exception.HoldNotActiveException;
import com.flagship.service_entitlement.exception.InvalidQuantityException;
import com.flagship.service_entitlement.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ServiceHoldTest {

    private static final Instant NOW = Instant.parse("2026-02-10T12:00:00Z");

    private ServiceHold hold(Instant expiryAt) {
        return ServiceHold.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            "mentoring_session", 2, UUID.randomUUID(), expiryAt, "booking-service", NOW);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("new holds are ACTIVE")
        void active() {
            ServiceHold hold = hold(null);

            assertEquals(HoldStatus.ACTIVE, hold.getStatus());
            assertTrue(hold.isActive());
            assertNull(hold.getReleasedAt());
        }

        @Test
        @DisplayName("quantity must be positive")
        void quantity() {
            assertThrows(InvalidQuantityException.class, () -> ServiceHold.create(UUID.randomUUID(),
                UUID.randomUUID(), UUID.randomUUID(), "mentoring_session", 0, null, null, "me", NOW));
        }

        @Test
        @DisplayName("service type is required")
        void serviceType() {
            assertThrows(ValidationException.class, () -> ServiceHold.create(UUID.randomUUID(),
                UUID.randomUUID(), UUID.randomUUID(), " ", 1, null, null, "me", NOW));
        }
    }

    @Nested
    @DisplayName("closing")
    class Closing {

        @Test
        @DisplayName("release records reason, actor and time")
        void release() {
            ServiceHold released = hold(null).release("rescheduled", "advisor", NOW.plusSeconds(5));

            assertEquals(HoldStatus.RELEASED, released.getStatus());
            assertEquals("rescheduled", released.getReleaseReason());
            assertEquals("advisor", released.getReleasedBy());
            assertEquals(NOW.plusSeconds(5), released.getReleasedAt());
        }

        @Test
        @DisplayName("a closed hold cannot be closed again")
        void closedIsTerminal() {
            ServiceHold cancelled = hold(null).cancel("student cancelled", "student", NOW);

            assertThrows(HoldNotActiveException.class, () -> cancelled.release("x", "y", NOW));
            assertThrows(HoldNotActiveException.class, () -> cancelled.cancel("x", "y", NOW));
            assertThrows(HoldNotActiveException.class, () -> cancelled.markAsExpired(NOW));
        }
    }

    @Nested
    @DisplayName("markAsExpired")
    class MarkAsExpired {

        @Test
        @DisplayName("expires once the expiry time is reached")
        void due() {
            ServiceHold hold = hold(NOW.minus(Duration.ofMinutes(1)));
            assertTrue(hold.isDue(NOW));

            ServiceHold expired = hold.markAsExpired(NOW);

            assertEquals(HoldStatus.EXPIRED, expired.getStatus());
            assertEquals(ServiceHold.REASON_EXPIRED, expired.getReleaseReason());
            assertNull(expired.getReleasedBy());
        }

        @Test
        @DisplayName("a hold without expiry never expires")
        void noExpiry() {
            ServiceHold hold = hold(null);

            assertFalse(hold.isDue(NOW.plus(Duration.ofDays(3650))));
            assertThrows(HoldCannotExpireException.class, () -> hold.markAsExpired(NOW));
        }

        @Test
        @DisplayName("cannot expire before its time")
        void notYet() {
            ServiceHold hold = hold(NOW.plus(Duration.ofHours(1)));

            assertFalse(hold.isDue(NOW));
            assertThrows(HoldCannotExpireException.class, () -> hold.markAsExpired(NOW));
        }
    }

    @Test
    @DisplayName("ACTIVE is the only non-terminal status")
    void statusTable() {
        assertTrue(HoldStatus.ACTIVE.canTransitionTo(HoldStatus.EXPIRED));
        assertFalse(HoldStatus.ACTIVE.isTerminal());
        assertTrue(HoldStatus.RELEASED.isTerminal());
        assertFalse(HoldStatus.EXPIRED.canTransitionTo(HoldStatus.ACTIVE));
    }
}
