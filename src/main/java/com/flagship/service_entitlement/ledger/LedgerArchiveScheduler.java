package com.flagship.service_entitlement.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the ledger archive on a cron, 02:00 daily by default.
 */
@Component
@ConditionalOnProperty(name = "ledger.archive.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerArchiveScheduler {

    private final LedgerArchiveService archiveService;

    @Scheduled(cron = "${ledger.archive.cron:0 0 2 * * *}")
    public void archiveOldLedgers() {
        try {
            archiveService.archiveOldLedgers();
        } catch (DataAccessException e) {
            log.error("Ledger archive run failed, will retry on next schedule: {}", e.getMessage(), e);
        }
    }
}
