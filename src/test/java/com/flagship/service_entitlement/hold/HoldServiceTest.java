package com.flagship.service_entitlement.hold;

import com.flagship.service_entitlement.contract.ContractGuard;
import com.flagship.service_entitlement.entitlement.BalanceService;
import com.flagship.service_entitlement.entitlement.EntitlementEntity;
import com.flagship.service_entitlement.entitlement.EntitlementSource;
import com.flagship.service_entitlement.entitlement.LockedEntitlements;
import com.flagship.service_entitlement.exception.ContractNotActiveException;
import com.flagship.service_entitlement.exception.HoldCannotExpireException;
import com.flagship.service_entitlement.exception.HoldNotActiveException;
import com.flagship.service_entitlement.exception.InsufficientBalanceException;
import com.flagship.service_entitlement.exception.LockTimeoutException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.contract.ContractStatus;
import com.flagship.service_entitlement.hold.event.HoldCreatedEvent;
import com.flagship.service_entitlement.hold.event.HoldReleasedEvent;
import com.flagship.service_entitlement.lock.RowLocks;
import com.flagship.service_entitlement.observability.EntitlementMetrics;
import com.flagship.service_entitlement.outbox.AggregateTypes;
import com.flagship.service_entitlement.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HoldServiceTest {

    private static final String SERVICE_TYPE = "essay_review";
    private static final Instant NOW = Instant.parse("2026-07-01T15:00:00Z");

    @Mock
    private ServiceHoldRepository holdRepository;
    @Mock
    private BalanceService balanceService;
    @Mock
    private ContractGuard contractGuard;
    @Mock
    private OutboxService outboxService;
    @Mock
    private JdbcTemplate jdbcTemplate;

    private HoldService holdService;
    private UUID studentId;
    private UUID contractId;
    private LockedEntitlements locked;

    @BeforeEach
    void setUp() {
        holdService = new HoldService(holdRepository, balanceService, contractGuard,
            new RowLocks(jdbcTemplate, 5000), outboxService,
            new EntitlementMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));
        studentId = UUID.randomUUID();
        contractId = UUID.randomUUID();
        locked = new LockedEntitlements(studentId, SERVICE_TYPE, List.of(EntitlementEntity.grant(
            studentId, SERVICE_TYPE, EntitlementSource.PRODUCT, contractId, 4, null, "system", NOW)));
    }

    private ServiceHoldEntity storedHold(Instant expiryAt) {
        locked.hold(2);
        ServiceHold hold = ServiceHold.create(UUID.randomUUID(), contractId, studentId, SERVICE_TYPE, 2,
            null, expiryAt, "booking-service", NOW.minus(Duration.ofHours(1)));
        ServiceHoldEntity entity = ServiceHoldEntity.fromDomain(hold);
        when(holdRepository.findById(hold.getId())).thenReturn(Optional.of(entity));
        return entity;
    }

    @Nested
    @DisplayName("createHold")
    class CreateHold {

        @Test
        @DisplayName("reserves units on an active contract and publishes HoldCreated")
        void reserves() {
            when(balanceService.lockEntitlements(studentId, SERVICE_TYPE)).thenReturn(locked);
            when(holdRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

            ServiceHold hold = holdService.createHold(new CreateHoldCommand(
                contractId, studentId, SERVICE_TYPE, 3, UUID.randomUUID(), null, "booking-service"));

            assertEquals(HoldStatus.ACTIVE, hold.getStatus());
            assertEquals(3, locked.totalHeld());
            assertEquals(1, locked.totalAvailable());
            verify(contractGuard).requireActiveFor(contractId, studentId);
            verify(outboxService).saveEvent(eq(AggregateTypes.STUDENT_ENTITLEMENT), eq(studentId),
                isA(HoldCreatedEvent.class));
        }

        @Test
        @DisplayName("fails on insufficient balance without saving")
        void insufficient() {
            when(balanceService.lockEntitlements(studentId, SERVICE_TYPE)).thenReturn(locked);

            assertThrows(InsufficientBalanceException.class, () -> holdService.createHold(new CreateHoldCommand(
                contractId, studentId, SERVICE_TYPE, 5, null, null, "booking-service")));

            verify(holdRepository, never()).save(any());
            verifyNoInteractions(outboxService);
        }

        @Test
        @DisplayName("a contract that is not active blocks the hold before any lock")
        void contractNotActive() {
            when(contractGuard.requireActiveFor(contractId, studentId))
                .thenThrow(new ContractNotActiveException(contractId, ContractStatus.SUSPENDED));

            assertThrows(ContractNotActiveException.class, () -> holdService.createHold(new CreateHoldCommand(
                contractId, studentId, SERVICE_TYPE, 1, null, null, "booking-service")));

            verifyNoInteractions(balanceService);
        }
    }

    @Nested
    @DisplayName("closing a hold")
    class Closing {

        @Test
        @DisplayName("release returns the held units")
        void release() {
            ServiceHoldEntity entity = storedHold(null);
            when(balanceService.lockEntitlements(studentId, SERVICE_TYPE)).thenReturn(locked);
            when(holdRepository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));

            ServiceHold released = holdService.releaseHold(entity.getId(), "rescheduled", "advisor");

            assertEquals(HoldStatus.RELEASED, released.getStatus());
            assertEquals(0, locked.totalHeld());
            assertEquals(4, locked.totalAvailable());
            verify(outboxService).saveEvent(eq(AggregateTypes.STUDENT_ENTITLEMENT), eq(studentId),
                isA(HoldReleasedEvent.class));
        }

        @Test
        @DisplayName("expiring before the expiry time changes nothing")
        void expireTooEarly() {
            ServiceHoldEntity entity = storedHold(NOW.plus(Duration.ofMinutes(30)));
            when(balanceService.lockEntitlements(studentId, SERVICE_TYPE)).thenReturn(locked);
            when(holdRepository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));

            assertThrows(HoldCannotExpireException.class, () -> holdService.expireHold(entity.getId()));

            assertEquals(2, locked.totalHeld());
            verify(holdRepository, never()).save(any());
        }

        @Test
        @DisplayName("a hold row that cannot be locked in time is a retryable lock timeout")
        void holdRowLockTimeout() {
            ServiceHoldEntity entity = storedHold(null);
            when(balanceService.lockEntitlements(studentId, SERVICE_TYPE)).thenReturn(locked);
            when(holdRepository.findByIdForUpdate(entity.getId()))
                .thenThrow(new CannotAcquireLockException("canceling statement due to lock timeout"));

            LockTimeoutException e = assertThrows(LockTimeoutException.class,
                () -> holdService.cancelHold(entity.getId(), "changed plans", "student"));

            assertTrue(e.isRetryable());
            assertEquals(2, locked.totalHeld());
            verify(jdbcTemplate).execute("SET LOCAL lock_timeout = '5000ms'");
            verify(holdRepository, never()).save(any());
        }

        @Test
        @DisplayName("a closed hold is rejected without locking")
        void alreadyClosed() {
            ServiceHold cancelled = ServiceHold.create(UUID.randomUUID(), contractId, studentId, SERVICE_TYPE, 1,
                null, null, "booking-service", NOW).cancel("changed plans", "student", NOW);
            when(holdRepository.findById(cancelled.getId()))
                .thenReturn(Optional.of(ServiceHoldEntity.fromDomain(cancelled)));

            assertThrows(HoldNotActiveException.class,
                () -> holdService.cancelHold(cancelled.getId(), "again", "student"));

            verifyNoInteractions(balanceService);
        }
    }

    @Test
    @DisplayName("completeHold rejects a hold of another service type")
    void completeHoldKeyMismatch() {
        ServiceHold other = ServiceHold.create(UUID.randomUUID(), contractId, studentId, "mock_interview", 1,
            null, null, "booking-service", NOW);
        when(holdRepository.findByIdForUpdate(other.getId()))
            .thenReturn(Optional.of(ServiceHoldEntity.fromDomain(other)));

        assertThrows(ValidationException.class,
            () -> holdService.completeHold(other.getId(), locked, "booking-service"));
    }
}
