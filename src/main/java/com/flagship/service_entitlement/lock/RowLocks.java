package com.flagship.service_entitlement.lock;

import com.flagship.service_entitlement.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Supplier;

/**
 * Runs row-locking queries under a transaction-local lock_timeout.
 *
 * A lock wait that runs out, or a deadlock the database resolves against the
 * caller, surfaces as a retryable {@link LockTimeoutException}. Contract rows,
 * entitlement rows and hold rows are all locked through here.
 */
@Component
@Slf4j
public class RowLocks {

    private final JdbcTemplate jdbcTemplate;
    private final long lockTimeoutMs;

    public RowLocks(JdbcTemplate jdbcTemplate,
                    @Value("${entitlement.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * @param target human-readable name of what is being locked, for logs and the error message
     * @param lockingQuery query that takes the row locks (FOR UPDATE / FOR SHARE)
     * @throws LockTimeoutException if the locks could not be acquired in time
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <T> T lock(String target, Supplier<T> lockingQuery) {
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
        try {
            return lockingQuery.get();
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock timeout on {} after {}ms: {}", target, lockTimeoutMs, e.getMessage());
            throw new LockTimeoutException(
                    String.format("Could not lock %s within %dms", target, lockTimeoutMs), e);
        }
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }
}
