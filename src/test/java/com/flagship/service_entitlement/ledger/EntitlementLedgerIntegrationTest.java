package com.flagship.service_entitlement.ledger;

import com.flagship.service_entitlement.contract.Contract;
import com.flagship.service_entitlement.contract.ContractStatus;
import com.flagship.service_entitlement.entitlement.AddAmendmentCommand;
import com.flagship.service_entitlement.entitlement.AmendmentService;
import com.flagship.service_entitlement.entitlement.AmendmentType;
import com.flagship.service_entitlement.entitlement.BalanceInfo;
import com.flagship.service_entitlement.entitlement.BalanceService;
import com.flagship.service_entitlement.exception.ContractNotActiveException;
import com.flagship.service_entitlement.exception.ExceedsConsumedException;
import com.flagship.service_entitlement.exception.InsufficientBalanceException;
import com.flagship.service_entitlement.hold.CreateHoldCommand;
import com.flagship.service_entitlement.hold.HoldService;
import com.flagship.service_entitlement.hold.HoldStatus;
import com.flagship.service_entitlement.hold.ServiceHold;
import com.flagship.service_entitlement.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract activation, consumption, refunds, holds and reconciliation against
 * a real database.
 */
class EntitlementLedgerIntegrationTest extends PostgresIntegrationTest {

    private static final String SESSION = "counseling_session";
    private static final String REVIEW = "essay_review";

    @Autowired
    private LedgerService ledgerService;
    @Autowired
    private BalanceService balanceService;
    @Autowired
    private HoldService holdService;
    @Autowired
    private ReconciliationService reconciliationService;
    @Autowired
    private AmendmentService amendmentService;
    @Autowired
    private LedgerQueryService ledgerQueryService;
    @Autowired
    private LedgerArchiveService archiveService;
    @Autowired
    private TransactionTemplate transactionTemplate;

    private UUID studentId;
    private Contract contract;

    @BeforeEach
    void setUp() {
        studentId = UUID.randomUUID();
        UUID productId = createProduct(Map.of(SESSION, 5, REVIEW, 2));
        contract = createActiveContract(studentId, productId);
    }

    private ConsumeCommand consume(int quantity) {
        return new ConsumeCommand(studentId, SESSION, quantity, UUID.randomUUID(), "booking-service",
            null, contract.getId(), "booking-service");
    }

    @Test
    @DisplayName("activation grants the product's entitlements")
    void activationGrants() {
        BalanceInfo sessions = balanceService.getBalance(studentId, SESSION);
        BalanceInfo reviews = balanceService.getBalance(studentId, REVIEW);

        assertEquals(5, sessions.getTotalQuantity());
        assertEquals(5, sessions.getAvailableQuantity());
        assertEquals(2, reviews.getAvailableQuantity());
    }

    @Test
    @DisplayName("consumption and refund move the balance and reconcile")
    void consumeAndRefund() {
        List<LedgerEntry> consumed = ledgerService.recordConsumption(consume(3));
        assertEquals(2, consumed.get(consumed.size() - 1).getBalanceAfter());
        assertEquals(-3, consumed.stream().mapToInt(LedgerEntry::getQuantity).sum());

        LedgerEntry refund = ledgerService.recordRefund(new RefundCommand(studentId, SESSION, 1, null, null,
            "session cancelled by mentor", "ops"));
        assertEquals(3, refund.getBalanceAfter());

        BalanceInfo balance = balanceService.getBalance(studentId, SESSION);
        assertEquals(2, balance.getConsumedQuantity());
        assertEquals(3, balance.getAvailableQuantity());

        ReconciliationReport report = reconciliationService.reconcile(studentId, SESSION);
        assertTrue(report.isBalanced());
        assertEquals(3, report.getLedgerConsumed());
        assertEquals(1, report.getLedgerRefunded());
        assertEquals(0, report.getDifference());
    }

    @Test
    @DisplayName("rejects consuming more than is available and writes nothing")
    void insufficientBalance() {
        assertThrows(InsufficientBalanceException.class, () -> ledgerService.recordConsumption(consume(6)));

        assertEquals(5, balanceService.getBalance(studentId, SESSION).getAvailableQuantity());
        assertTrue(ledgerQueryService.queryLedger(new LedgerFilter(studentId, SESSION, null, null),
            false, null, null).isEmpty());
    }

    @Test
    @DisplayName("rejects refunding more than was consumed")
    void refundBeyondConsumed() {
        ledgerService.recordConsumption(consume(1));

        assertThrows(ExceedsConsumedException.class, () -> ledgerService.recordRefund(
            new RefundCommand(studentId, SESSION, 2, null, null, null, "ops")));
    }

    @Test
    @DisplayName("adjustments change the balance but stay out of reconciliation")
    void adjustmentIsNotReconciled() {
        ledgerService.recordConsumption(consume(2));
        LedgerEntry adjustment = ledgerService.recordAdjustment(studentId, SESSION, 4, "goodwill credit", "ops");

        assertEquals(7, adjustment.getBalanceAfter());
        ReconciliationReport report = reconciliationService.reconcile(studentId, SESSION);
        assertTrue(report.isBalanced());
        assertEquals(4, report.getAdjustmentTotal());
    }

    @Test
    @DisplayName("an amendment adds a grant row and an adjustment entry")
    void amendmentAddsUnits() {
        amendmentService.addAmendment(new AddAmendmentCommand(studentId, contract.getId(), REVIEW,
            AmendmentType.PROMOTION, 3, "spring promotion", null, null, "advisor"));

        assertEquals(5, balanceService.getBalance(studentId, REVIEW).getAvailableQuantity());
        assertEquals(1, amendmentService.listAmendments(studentId).size());
    }

    @Test
    @DisplayName("a hold reserves units until the session is consumed")
    void holdThenConsume() {
        ServiceHold hold = holdService.createHold(new CreateHoldCommand(contract.getId(), studentId, SESSION, 2,
            null, Instant.now().plus(Duration.ofDays(1)), "booking-service"));
        assertEquals(3, balanceService.getBalance(studentId, SESSION).getAvailableQuantity());

        assertThrows(InsufficientBalanceException.class, () -> ledgerService.recordConsumption(consume(4)));

        ledgerService.recordConsumption(new ConsumeCommand(studentId, SESSION, 2, null, null, hold.getId(),
            contract.getId(), "booking-service"));

        BalanceInfo balance = balanceService.getBalance(studentId, SESSION);
        assertEquals(0, balance.getHeldQuantity());
        assertEquals(2, balance.getConsumedQuantity());
        assertEquals(3, balance.getAvailableQuantity());
        assertEquals(HoldStatus.RELEASED, holdService.getHold(hold.getId()).getStatus());
    }

    @Test
    @DisplayName("termination cancels active holds and blocks further use")
    void terminationCancelsHolds() {
        ServiceHold hold = holdService.createHold(new CreateHoldCommand(contract.getId(), studentId, REVIEW, 1,
            null, null, "booking-service"));

        contractService.transitionStatus(contract.getId(), ContractStatus.TERMINATED, "refund issued", "ops");

        assertEquals(HoldStatus.CANCELLED, holdService.getHold(hold.getId()).getStatus());
        assertEquals(0, balanceService.getBalance(studentId, REVIEW).getHeldQuantity());
        assertThrows(ContractNotActiveException.class, () -> ledgerService.recordConsumption(consume(1)));
        assertEquals(4, contractService.getStatusHistory(contract.getId()).size());
    }

    @Test
    @DisplayName("termination waits for an in-flight hold and then cancels it")
    void terminationWaitsForInFlightHold() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        AtomicReference<Future<Contract>> termination = new AtomicReference<>();
        try {
            UUID holdId = transactionTemplate.execute(status -> {
                ServiceHold hold = holdService.createHold(new CreateHoldCommand(contract.getId(), studentId,
                    REVIEW, 2, null, null, "booking-service"));
                termination.set(executor.submit(() -> contractService.transitionStatus(
                    contract.getId(), ContractStatus.TERMINATED, "refund issued", "ops")));
                assertThrows(TimeoutException.class, () -> termination.get().get(500, TimeUnit.MILLISECONDS));
                return hold.getId();
            });

            assertEquals(ContractStatus.TERMINATED, termination.get().get(10, TimeUnit.SECONDS).getStatus());
            assertEquals(HoldStatus.CANCELLED, holdService.getHold(holdId).getStatus());
            assertEquals(0, balanceService.getBalance(studentId, REVIEW).getHeldQuantity());
            assertEquals(2, balanceService.getBalance(studentId, REVIEW).getAvailableQuantity());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("a hold placed after termination is rejected")
    void holdAfterTermination() {
        contractService.transitionStatus(contract.getId(), ContractStatus.TERMINATED, "refund issued", "ops");

        assertThrows(ContractNotActiveException.class, () -> holdService.createHold(new CreateHoldCommand(
            contract.getId(), studentId, REVIEW, 1, null, null, "booking-service")));
        assertEquals(0, balanceService.getBalance(studentId, REVIEW).getHeldQuantity());
    }

    @Test
    @DisplayName("concurrent consumption never overdraws the balance")
    void concurrentConsumption() throws InterruptedException {
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.recordConsumption(consume(1));
                    succeeded.incrementAndGet();
                } catch (InsufficientBalanceException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(5, succeeded.get());
        assertEquals(5, rejected.get());
        assertEquals(0, balanceService.getBalance(studentId, SESSION).getAvailableQuantity());
        assertTrue(reconciliationService.reconcile(studentId, SESSION).isBalanced());
    }

    @Test
    @DisplayName("archived entries are only returned when the archive is included")
    void archiveAndQuery() {
        String serviceType = "archive_check_" + UUID.randomUUID().toString().substring(0, 8);
        archiveService.createPolicy(new ArchivePolicyCommand(ArchiveScope.SERVICE_TYPE, serviceType, 30,
            true, true, "ops"));

        Instant old = Instant.now().minus(Duration.ofDays(200));
        UUID entryId = UUID.randomUUID();
        jdbcTemplate.update("""
            INSERT INTO service_ledgers (id, student_id, service_type, quantity, type, source, balance_after,
                                         created_by, created_at)
            VALUES (?, ?, ?, -1, 'consumption', 'booking_completed', 4, 'booking-service', ?)
            """, entryId, studentId, serviceType, Timestamp.from(old));

        LedgerRepository.ArchiveResult result = archiveService.archiveOldLedgers();
        assertTrue(result.archived() >= 1);
        assertTrue(result.deleted() >= 1);

        LedgerFilter window = new LedgerFilter(studentId, serviceType, old.minus(Duration.ofDays(1)),
            old.plus(Duration.ofDays(1)));
        assertTrue(ledgerQueryService.queryLedger(window, false, null, null).isEmpty());

        List<LedgerEntry> withArchive = ledgerQueryService.queryLedger(window, true, null, null);
        assertEquals(1, withArchive.size());
        assertEquals(entryId, withArchive.get(0).getId());
        assertTrue(withArchive.get(0).isArchived());
    }
}
