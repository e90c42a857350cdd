package com.flagship.service_entitlement.entitlement;

import com.flagship.service_entitlement.exception.LockTimeoutException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.lock.RowLocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BalanceServiceTest {

    private static final String SERVICE_TYPE = "counseling_session";
    private static final Instant NOW = Instant.parse("2026-05-11T09:30:00Z");

    @Mock
    private EntitlementRepository entitlementRepository;
    @Mock
    private JdbcTemplate jdbcTemplate;

    private BalanceService balanceService;
    private UUID studentId;

    @BeforeEach
    void setUp() {
        balanceService = new BalanceService(entitlementRepository, new RowLocks(jdbcTemplate, 750));
        studentId = UUID.randomUUID();
    }

    private EntitlementEntity row(int total, int consumed, int held) {
        EntitlementEntity row = EntitlementEntity.grant(studentId, SERVICE_TYPE, EntitlementSource.PRODUCT,
            UUID.randomUUID(), total, null, "system", NOW);
        LockedEntitlements view = new LockedEntitlements(studentId, SERVICE_TYPE, List.of(row));
        if (consumed > 0) {
            view.consume(consumed);
        }
        if (held > 0) {
            view.hold(held);
        }
        return row;
    }

    @Nested
    @DisplayName("lockEntitlements")
    class Lock {

        @Test
        @DisplayName("sets the transaction-local lock timeout before locking")
        void setsLockTimeout() {
            when(entitlementRepository.findAllForUpdate(studentId, SERVICE_TYPE)).thenReturn(List.of(row(5, 0, 0)));

            LockedEntitlements locked = balanceService.lockEntitlements(studentId, SERVICE_TYPE);

            assertEquals(5, locked.totalAvailable());
            verify(jdbcTemplate).execute("SET LOCAL lock_timeout = '750ms'");
        }

        @Test
        @DisplayName("a lock wait timeout becomes a retryable LockTimeoutException")
        void lockTimeout() {
            when(entitlementRepository.findAllForUpdate(studentId, SERVICE_TYPE))
                .thenThrow(new PessimisticLockingFailureException("lock timeout"));

            LockTimeoutException e = assertThrows(LockTimeoutException.class,
                () -> balanceService.lockEntitlements(studentId, SERVICE_TYPE));

            assertTrue(e.isRetryable());
            assertTrue(e.getMessage().contains(studentId.toString()));
            assertInstanceOf(PessimisticLockingFailureException.class, e.getCause());
        }

        @Test
        @DisplayName("a deadlock victim is retryable as well")
        void deadlock() {
            when(entitlementRepository.findAllForUpdate(studentId, SERVICE_TYPE))
                .thenThrow(new CannotAcquireLockException("deadlock detected"));

            assertThrows(LockTimeoutException.class,
                () -> balanceService.lockEntitlements(studentId, SERVICE_TYPE));
        }

        @Test
        @DisplayName("a key without rows is not found, unless empty keys are allowed")
        void emptyKey() {
            when(entitlementRepository.findAllForUpdate(studentId, SERVICE_TYPE)).thenReturn(List.of());

            assertThrows(NotFoundException.class, () -> balanceService.lockEntitlements(studentId, SERVICE_TYPE));
            assertTrue(balanceService.lockEntitlementsAllowEmpty(studentId, SERVICE_TYPE).isEmpty());
        }

        @Test
        @DisplayName("a blank service type is rejected before touching the database")
        void blankServiceType() {
            assertThrows(ValidationException.class, () -> balanceService.lockEntitlements(studentId, " "));

            verifyNoInteractions(jdbcTemplate, entitlementRepository);
        }
    }

    @Test
    @DisplayName("getBalance sums every row of the key")
    void getBalance() {
        when(entitlementRepository.findByStudentIdAndServiceTypeOrderByIdAsc(studentId, SERVICE_TYPE))
            .thenReturn(List.of(row(5, 2, 1), row(3, 0, 0)));

        BalanceInfo balance = balanceService.getBalance(studentId, SERVICE_TYPE);

        assertEquals(8, balance.getTotalQuantity());
        assertEquals(2, balance.getConsumedQuantity());
        assertEquals(1, balance.getHeldQuantity());
        assertEquals(5, balance.getAvailableQuantity());
    }
}
