package com.flagship.service_entitlement.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Opt-in periodic reconciliation of every entitlement key.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Scheduled(fixedDelayString = "${reconciliation.scheduler.interval-ms:3600000}",
               initialDelayString = "${reconciliation.scheduler.interval-ms:3600000}")
    public void reconcileAll() {
        int mismatches = reconciliationService.reconcileAll().size();
        if (mismatches > 0) {
            log.warn("{} entitlement keys do not reconcile with the ledger", mismatches);
        }
    }
}
