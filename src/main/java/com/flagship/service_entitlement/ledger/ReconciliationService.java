package com.flagship.service_entitlement.ledger;

import com.flagship.service_entitlement.entitlement.BalanceInfo;
import com.flagship.service_entitlement.entitlement.EntitlementEntity;
import com.flagship.service_entitlement.entitlement.EntitlementKey;
import com.flagship.service_entitlement.entitlement.EntitlementRepository;
import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.observability.EntitlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Checks that the ledger explains the consumed quantity on the entitlement rows.
 *
 * Net ledger consumption (consumption minus refunds, live and archived) must
 * equal the sum of consumedQuantity. Mismatches are reported and counted; this
 * service never corrects anything and takes no locks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final EntitlementRepository entitlementRepository;
    private final LedgerRepository ledgerRepository;
    private final EntitlementMetrics metrics;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean reconcileBalance(UUID studentId, String serviceType) {
        return reconcile(studentId, serviceType).isBalanced();
    }

    /**
     * @throws NotFoundException if the key has no entitlement rows
     */
    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(UUID studentId, String serviceType) {
        List<EntitlementEntity> rows =
                entitlementRepository.findByStudentIdAndServiceTypeOrderByIdAsc(studentId, serviceType);
        if (rows.isEmpty()) {
            throw NotFoundException.entitlements(studentId, serviceType);
        }
        BalanceInfo balance = BalanceInfo.of(studentId, serviceType, rows);
        LedgerTotals totals = ledgerRepository.sumTotals(studentId, serviceType);

        boolean balanced = totals.netConsumed() == balance.getConsumedQuantity();
        ReconciliationReport report = ReconciliationReport.builder()
                .studentId(studentId)
                .serviceType(serviceType)
                .ledgerConsumed(totals.consumed())
                .ledgerRefunded(totals.refunded())
                .netLedgerConsumed(totals.netConsumed())
                .entitlementConsumed(balance.getConsumedQuantity())
                .adjustmentTotal(totals.adjusted())
                .balanced(balanced)
                .checkedAt(clock.instant())
                .build();

        metrics.recordReconciliation(balanced);
        if (balanced) {
            log.debug("Reconciled student={}, serviceType={}: consumed={}", studentId, serviceType,
                    balance.getConsumedQuantity());
        } else {
            log.warn("Reconciliation mismatch for student={}, serviceType={}: ledgerNet={}, entitlementConsumed={}, difference={}",
                    studentId, serviceType, totals.netConsumed(), balance.getConsumedQuantity(), report.getDifference());
        }
        return report;
    }

    /**
     * Reconciles every key that has entitlement rows.
     *
     * @return the reports of the keys that did not reconcile
     */
    @Transactional(readOnly = true)
    public List<ReconciliationReport> reconcileAll() {
        List<ReconciliationReport> mismatches = new ArrayList<>();
        int checked = 0;
        for (EntitlementKey key : entitlementRepository.findAllKeys()) {
            try {
                ReconciliationReport report = reconcile(key.studentId(), key.serviceType());
                checked++;
                if (!report.isBalanced()) {
                    mismatches.add(report);
                }
            } catch (EntitlementLedgerException e) {
                log.warn("Could not reconcile student={}, serviceType={}: {}",
                        key.studentId(), key.serviceType(), e.getMessage());
            }
        }
        log.info("Reconciliation sweep finished: checked={}, mismatches={}", checked, mismatches.size());
        return mismatches;
    }
}
