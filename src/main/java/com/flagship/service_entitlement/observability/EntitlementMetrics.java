package com.flagship.service_entitlement.observability;

import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for entitlement, ledger, hold and contract operations.
 *
 * Metrics exposed:
 * - entitlement.operation.latency{operation, outcome}
 * - entitlement.operation.rejected{operation, code}
 * - ledger.entries.written{type}
 * - holds.transitions{status}
 * - contracts.transitions{from, to}
 * - reconciliation.checks{result}
 * - ledger.archive.rows
 * - idempotency.cache{result}
 */
@Component
public class EntitlementMetrics {

    private final MeterRegistry registry;

    public EntitlementMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSuccess(String operation, long durationMs) {
        registry.timer("entitlement.operation.latency",
                "operation", operation,
                "outcome", "success"
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Records a failed operation. Business rejections are tagged with their error
     * code; anything else counts as an error.
     */
    public void recordFailure(String operation, Exception e, long durationMs) {
        String outcome = e instanceof EntitlementLedgerException ? "rejected" : "error";
        registry.timer("entitlement.operation.latency",
                "operation", operation,
                "outcome", outcome
        ).record(Duration.ofMillis(durationMs));

        if (e instanceof EntitlementLedgerException ledgerException) {
            registry.counter("entitlement.operation.rejected",
                    "operation", operation,
                    "code", ledgerException.getErrorCode().name()
            ).increment();
        }
    }

    public void recordLedgerEntries(String type, int count) {
        registry.counter("ledger.entries.written", "type", type).increment(count);
    }

    public void recordHoldTransition(String status) {
        registry.counter("holds.transitions", "status", status).increment();
    }

    public void recordContractTransition(String from, String to) {
        registry.counter("contracts.transitions", "from", from, "to", to).increment();
    }

    public void recordReconciliation(boolean balanced) {
        registry.counter("reconciliation.checks", "result", balanced ? "balanced" : "mismatch").increment();
    }

    public void recordArchivedRows(int rows) {
        registry.counter("ledger.archive.rows").increment(rows);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }
}
