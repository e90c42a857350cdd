package com.flagship.service_entitlement.hold;

import com.flagship.service_entitlement.exception.EntitlementLedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Expires ACTIVE holds whose expiry time has passed.
 *
 * Each hold is expired in its own transaction, so one bad hold does not block
 * the rest of the batch.
 */
@Component
@ConditionalOnProperty(name = "hold.expiry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class HoldExpiryScheduler {

    private final HoldService holdService;

    @Value("${hold.expiry.batch-size:200}")
    private int batchSize;

    /**
     * @return number of holds expired in this run
     */
    @Scheduled(fixedDelayString = "${hold.expiry.poll-interval-ms:60000}")
    public int expireDueHolds() {
        List<UUID> due = holdService.findDueHoldIds(batchSize);
        if (due.isEmpty()) {
            return 0;
        }

        log.debug("Expiring {} due holds", due.size());
        int expired = 0;
        int failed = 0;
        for (UUID holdId : due) {
            try {
                holdService.expireHold(holdId);
                expired++;
            } catch (EntitlementLedgerException e) {
                // closed concurrently, or the expiry was moved
                failed++;
                log.warn("Skipped expiry of hold {}: {}", holdId, e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to expire hold {}: {}", holdId, e.getMessage(), e);
            }
        }

        log.info("Hold expiry sweep finished: expired={}, failed={}", expired, failed);
        return expired;
    }
}
