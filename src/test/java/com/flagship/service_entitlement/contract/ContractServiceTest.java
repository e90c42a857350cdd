package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.contract.event.ContractCreatedEvent;
import com.flagship.service_entitlement.contract.event.ContractStatusChangedEvent;
import com.flagship.service_entitlement.entitlement.EntitlementGrantService;
import com.flagship.service_entitlement.exception.InvalidStateTransitionException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.hold.HoldService;
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

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-10T08:00:00Z");
    private static final String KEY = "create-7f3a";

    @Mock
    private ContractPersistenceService persistenceService;
    @Mock
    private ContractDirectory contractDirectory;
    @Mock
    private ContractNumberGenerator numberGenerator;
    @Mock
    private ContractIdempotencyService idempotencyService;
    @Mock
    private EntitlementGrantService grantService;
    @Mock
    private HoldService holdService;
    @Mock
    private OutboxService outboxService;

    private ContractService contractService;
    private UUID studentId;
    private UUID productId;

    @BeforeEach
    void setUp() {
        contractService = new ContractService(persistenceService, contractDirectory, numberGenerator,
            idempotencyService, grantService, holdService, outboxService,
            new EntitlementMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));
        studentId = UUID.randomUUID();
        productId = UUID.randomUUID();
    }

    private CreateContractCommand command() {
        return new CreateContractCommand(studentId, productId, "Ivy package", new BigDecimal("4800.00"),
            CurrencyCode.USD, 180, "advisor-12");
    }

    private Contract draft() {
        ProductSnapshot snapshot = ProductSnapshot.of(productId, List.of(new ProductItem("mock_interview", 4)));
        return Contract.draft(UUID.randomUUID(), "CT-202605-00001", studentId, productId, "Ivy package",
            new BigDecimal("4800.00"), CurrencyCode.USD, 180, snapshot, "advisor-12", NOW.minusSeconds(3600));
    }

    @Nested
    @DisplayName("createContract")
    class Create {

        @Test
        @DisplayName("returns the earlier contract for a reused key without writing anything")
        void idempotentHit() {
            Contract existing = draft();
            when(idempotencyService.findContractId(KEY)).thenReturn(Optional.of(existing.getId()));
            when(persistenceService.findById(existing.getId())).thenReturn(Optional.of(existing));

            ContractCreationResult result = contractService.createContract(command(), KEY);

            assertFalse(result.created());
            assertEquals(existing.getId(), result.contract().getId());
            verify(persistenceService, never()).save(any(), any());
            verifyNoInteractions(outboxService, numberGenerator);
        }

        @Test
        @DisplayName("snapshots the catalog items and records history and an outbox event")
        void createsDraft() {
            when(idempotencyService.findContractId(KEY)).thenReturn(Optional.empty());
            when(contractDirectory.listProductItems(productId))
                .thenReturn(List.of(new ProductItem("mock_interview", 4), new ProductItem("essay_review", 2)));
            when(numberGenerator.next()).thenReturn("CT-202605-00042");
            when(persistenceService.save(any(Contract.class), eq(KEY))).thenAnswer(inv -> inv.getArgument(0));

            ContractCreationResult result = contractService.createContract(command(), KEY);

            assertTrue(result.created());
            Contract created = result.contract();
            assertEquals(ContractStatus.DRAFT, created.getStatus());
            assertEquals("CT-202605-00042", created.getContractNumber());
            assertEquals(2, created.getProductSnapshot().items().size());
            assertEquals(NOW, created.getCreatedAt());
            verify(persistenceService).recordHistory(eq(created.getId()), isNull(), eq(ContractStatus.DRAFT),
                eq(NOW), eq("advisor-12"), isNull(), anyMap());
            verify(outboxService).saveEvent(eq(AggregateTypes.CONTRACT), eq(created.getId()),
                isA(ContractCreatedEvent.class));
            verify(idempotencyService).remember(KEY, created.getId());
        }

        @Test
        @DisplayName("rejects a product without service items")
        void emptyProduct() {
            when(idempotencyService.findContractId(KEY)).thenReturn(Optional.empty());
            when(contractDirectory.listProductItems(productId)).thenReturn(List.of());
            when(numberGenerator.next()).thenReturn("CT-202605-00043");

            assertThrows(ValidationException.class, () -> contractService.createContract(command(), KEY));
            verify(persistenceService, never()).save(any(), any());
        }
    }

    @Nested
    @DisplayName("transitionStatus")
    class Transition {

        @Test
        @DisplayName("grants product entitlements on first activation")
        void firstActivationGrants() {
            Contract signed = draft().transitionTo(ContractStatus.SIGNED, null, NOW.minusSeconds(60));
            when(persistenceService.lockById(signed.getId())).thenReturn(signed);
            when(persistenceService.update(any(Contract.class))).thenAnswer(inv -> inv.getArgument(0));
            when(grantService.grantFromContract(any(Contract.class), eq("ops-1"))).thenReturn(List.of());

            Contract active = contractService.transitionStatus(signed.getId(), ContractStatus.ACTIVE, null, "ops-1");

            assertEquals(ContractStatus.ACTIVE, active.getStatus());
            assertEquals(NOW, active.getActivatedAt());
            verify(grantService).grantFromContract(active, "ops-1");
            verify(persistenceService).recordHistory(eq(signed.getId()), eq(ContractStatus.SIGNED),
                eq(ContractStatus.ACTIVE), eq(NOW), eq("ops-1"), isNull(), isNull());
            verify(outboxService).saveEvent(eq(AggregateTypes.CONTRACT), eq(signed.getId()),
                isA(ContractStatusChangedEvent.class));
        }

        @Test
        @DisplayName("does not grant again when a suspended contract is reactivated")
        void reactivationDoesNotGrant() {
            Contract suspended = draft()
                .transitionTo(ContractStatus.SIGNED, null, NOW.minusSeconds(300))
                .transitionTo(ContractStatus.ACTIVE, null, NOW.minusSeconds(200))
                .transitionTo(ContractStatus.SUSPENDED, "payment overdue", NOW.minusSeconds(100));
            when(persistenceService.lockById(suspended.getId())).thenReturn(suspended);
            when(persistenceService.update(any(Contract.class))).thenAnswer(inv -> inv.getArgument(0));

            Contract active = contractService.transitionStatus(suspended.getId(), ContractStatus.ACTIVE, null, null);

            assertEquals(ContractStatus.ACTIVE, active.getStatus());
            assertNull(active.getSuspendedReason());
            verifyNoInteractions(grantService);
            verify(persistenceService).recordHistory(eq(suspended.getId()), eq(ContractStatus.SUSPENDED),
                eq(ContractStatus.ACTIVE), eq(NOW), eq("system"), isNull(), isNull());
        }

        @Test
        @DisplayName("cancels active holds on termination")
        void terminationCancelsHolds() {
            Contract active = draft()
                .transitionTo(ContractStatus.SIGNED, null, NOW.minusSeconds(300))
                .transitionTo(ContractStatus.ACTIVE, null, NOW.minusSeconds(200));
            when(persistenceService.lockById(active.getId())).thenReturn(active);
            when(persistenceService.update(any(Contract.class))).thenAnswer(inv -> inv.getArgument(0));
            when(holdService.cancelActiveHoldsForContract(eq(active.getId()), startsWith("contract terminated"),
                eq("ops-2"))).thenReturn(3);

            Contract terminated = contractService.transitionStatus(active.getId(), ContractStatus.TERMINATED,
                "refund requested", "ops-2");

            assertEquals(ContractStatus.TERMINATED, terminated.getStatus());
            assertEquals("refund requested", terminated.getTerminatedReason());
            verify(persistenceService).recordHistory(eq(active.getId()), eq(ContractStatus.ACTIVE),
                eq(ContractStatus.TERMINATED), eq(NOW), eq("ops-2"), eq("refund requested"), anyMap());
        }

        @Test
        @DisplayName("rejects a move the status table does not allow")
        void invalidTransition() {
            Contract contract = draft();
            when(persistenceService.lockById(contract.getId())).thenReturn(contract);

            assertThrows(InvalidStateTransitionException.class,
                () -> contractService.transitionStatus(contract.getId(), ContractStatus.ACTIVE, null, "ops-1"));
            verify(persistenceService, never()).update(any());
            verifyNoInteractions(grantService, holdService, outboxService);
        }

        @Test
        @DisplayName("requires a reason to suspend")
        void suspendNeedsReason() {
            Contract active = draft()
                .transitionTo(ContractStatus.SIGNED, null, NOW.minusSeconds(300))
                .transitionTo(ContractStatus.ACTIVE, null, NOW.minusSeconds(200));
            when(persistenceService.lockById(active.getId())).thenReturn(active);

            assertThrows(ValidationException.class,
                () -> contractService.transitionStatus(active.getId(), ContractStatus.SUSPENDED, " ", "ops-1"));
            verify(persistenceService, never()).update(any());
        }
    }

    @Test
    @DisplayName("history of an unknown contract is not found")
    void historyOfUnknownContract() {
        UUID contractId = UUID.randomUUID();
        when(persistenceService.findById(contractId)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> contractService.getStatusHistory(contractId));
    }
}
