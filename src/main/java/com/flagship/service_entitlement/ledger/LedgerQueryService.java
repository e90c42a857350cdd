package com.flagship.service_entitlement.ledger;

import com.flagship.service_entitlement.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read side of the ledger: validates query windows and paging before handing
 * the query to {@link LedgerRepository}.
 *
 * Archive queries are bounded in time: a missing bound is completed to a
 * one-year window, no bounds at all means the default lookback, and the whole
 * range may not exceed the configured maximum.
 */
@Service
@Slf4j
public class LedgerQueryService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 100;
    static final int MAX_OFFSET = 10_000;
    static final Duration AUTO_COMPLETE_WINDOW = Duration.ofDays(365);

    private final LedgerRepository ledgerRepository;
    private final Clock clock;
    private final Duration defaultLookback;
    private final Duration maxArchiveRange;

    public LedgerQueryService(LedgerRepository ledgerRepository,
                              Clock clock,
                              @Value("${ledger.query.default-lookback-days:90}") int defaultLookbackDays,
                              @Value("${ledger.query.max-archive-range-days:365}") int maxArchiveRangeDays) {
        this.ledgerRepository = ledgerRepository;
        this.clock = clock;
        this.defaultLookback = Duration.ofDays(defaultLookbackDays);
        this.maxArchiveRange = Duration.ofDays(maxArchiveRangeDays);
    }

    /**
     * @param limit  page size, 1..100, defaults to 50
     * @param offset rows to skip, 0..10000, defaults to 0
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> queryLedger(LedgerFilter filter, boolean includeArchive, Integer limit, Integer offset) {
        if (filter == null || (filter.studentId() == null && (filter.serviceType() == null || filter.serviceType().isBlank()))) {
            throw new ValidationException("Either studentId or serviceType is required");
        }
        int pageLimit = limit == null ? DEFAULT_LIMIT : limit;
        int pageOffset = offset == null ? 0 : offset;
        if (pageLimit < 1 || pageLimit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (pageOffset < 0 || pageOffset > MAX_OFFSET) {
            throw new ValidationException("offset must be between 0 and " + MAX_OFFSET);
        }
        if (filter.from() != null && filter.to() != null && filter.from().isAfter(filter.to())) {
            throw new ValidationException("from must not be after to");
        }

        LedgerFilter effective = includeArchive ? boundArchiveWindow(filter) : filter;
        log.debug("Ledger query: filter={}, includeArchive={}, limit={}, offset={}",
                effective, includeArchive, pageLimit, pageOffset);
        return ledgerRepository.query(effective, new LedgerPage(includeArchive, pageLimit, pageOffset));
    }

    LedgerFilter boundArchiveWindow(LedgerFilter filter) {
        Instant from = filter.from();
        Instant to = filter.to();
        if (from == null && to == null) {
            to = clock.instant();
            from = to.minus(defaultLookback);
        } else if (from == null) {
            from = to.minus(AUTO_COMPLETE_WINDOW);
        } else if (to == null) {
            to = from.plus(AUTO_COMPLETE_WINDOW);
        }

        if (Duration.between(from, to).compareTo(maxArchiveRange) > 0) {
            throw new ValidationException(String.format(
                    "Archive queries may span at most %d days", maxArchiveRange.toDays()));
        }
        return filter.withRange(from, to);
    }
}
