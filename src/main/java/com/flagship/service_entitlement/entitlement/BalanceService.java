package com.flagship.service_entitlement.entitlement;

import com.flagship.service_entitlement.exception.LockTimeoutException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.lock.RowLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reads aggregated balances and hands out locked views of a key's entitlement rows.
 *
 * Every mutation of a key goes through {@link #lockEntitlements}: rows are locked
 * with SELECT ... FOR UPDATE in (service_type, id) order under a transaction-local
 * lock_timeout, so writers on the same key serialize and nothing waits forever.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceService {

    private final EntitlementRepository entitlementRepository;
    private final RowLocks rowLocks;

    @Transactional(readOnly = true)
    public BalanceInfo getBalance(UUID studentId, String serviceType) {
        requireKey(studentId, serviceType);
        List<EntitlementEntity> rows =
                entitlementRepository.findByStudentIdAndServiceTypeOrderByIdAsc(studentId, serviceType);
        if (rows.isEmpty()) {
            throw NotFoundException.entitlements(studentId, serviceType);
        }
        return BalanceInfo.of(studentId, serviceType, rows);
    }

    /**
     * One aggregated entry per service type, ordered by service type.
     * With {@code serviceType} set this is the single-key balance as a list.
     */
    @Transactional(readOnly = true)
    public List<BalanceInfo> getBalances(UUID studentId, String serviceType) {
        if (studentId == null) {
            throw new ValidationException("Student ID is required");
        }
        if (serviceType != null && !serviceType.isBlank()) {
            return List.of(getBalance(studentId, serviceType));
        }

        Map<String, List<EntitlementEntity>> byServiceType = new LinkedHashMap<>();
        for (EntitlementEntity row : entitlementRepository.findByStudentIdOrderByServiceTypeAscIdAsc(studentId)) {
            byServiceType.computeIfAbsent(row.getServiceType(), k -> new ArrayList<>()).add(row);
        }

        List<BalanceInfo> balances = new ArrayList<>();
        byServiceType.forEach((type, rows) -> balances.add(BalanceInfo.of(studentId, type, rows)));
        return balances;
    }

    /**
     * Locks every entitlement row of the key for the rest of the caller's transaction.
     *
     * @throws NotFoundException if the key has no rows
     * @throws LockTimeoutException if the rows could not be locked in time
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LockedEntitlements lockEntitlements(UUID studentId, String serviceType) {
        LockedEntitlements locked = lockEntitlementsAllowEmpty(studentId, serviceType);
        if (locked.isEmpty()) {
            throw NotFoundException.entitlements(studentId, serviceType);
        }
        return locked;
    }

    /**
     * As {@link #lockEntitlements}, but an empty key is returned rather than
     * rejected. Used when the caller is about to grant the first row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LockedEntitlements lockEntitlementsAllowEmpty(UUID studentId, String serviceType) {
        requireKey(studentId, serviceType);
        List<EntitlementEntity> rows = rowLocks.lock(
                String.format("entitlements of student %s for %s", studentId, serviceType),
                () -> entitlementRepository.findAllForUpdate(studentId, serviceType));
        log.debug("Locked {} entitlement rows for student={}, serviceType={}", rows.size(), studentId, serviceType);
        return new LockedEntitlements(studentId, serviceType, rows);
    }

    private static void requireKey(UUID studentId, String serviceType) {
        if (studentId == null) {
            throw new ValidationException("Student ID is required");
        }
        if (serviceType == null || serviceType.isBlank()) {
            throw new ValidationException("Service type is required");
        }
    }
}
