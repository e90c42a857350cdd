package com.flagship.service_entitlement.entitlement;

import com.flagship.service_entitlement.exception.ExceedsConsumedException;
import com.flagship.service_entitlement.exception.InsufficientBalanceException;
import com.flagship.service_entitlement.exception.InvalidQuantityException;
import com.flagship.service_entitlement.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * The entitlement rows of one key, locked for the current transaction.
 *
 * Each operation checks its business rule against the aggregate before touching
 * any row, so a rejected operation leaves every row unchanged. Rows are kept in
 * lock order (ascending id), which is also FIFO order.
 */
public class LockedEntitlements {

    /**
     * Units taken from one entitlement row, with the aggregate available balance
     * of the key right after the deduction.
     */
    public record Allocation(Long entitlementId, int quantity, int balanceAfter) {
    }

    private final UUID studentId;
    private final String serviceType;
    private final List<EntitlementEntity> rows;

    public LockedEntitlements(UUID studentId, String serviceType, List<EntitlementEntity> rows) {
        this.studentId = studentId;
        this.serviceType = serviceType;
        this.rows = new ArrayList<>(rows);
    }

    public UUID getStudentId() {
        return studentId;
    }

    public String getServiceType() {
        return serviceType;
    }

    public List<EntitlementEntity> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int totalAvailable() {
        return rows.stream().mapToInt(EntitlementEntity::getAvailableQuantity).sum();
    }

    public int totalConsumed() {
        return rows.stream().mapToInt(EntitlementEntity::getConsumedQuantity).sum();
    }

    public int totalHeld() {
        return rows.stream().mapToInt(EntitlementEntity::getHeldQuantity).sum();
    }

    public BalanceInfo toBalanceInfo() {
        return BalanceInfo.of(studentId, serviceType, rows);
    }

    /**
     * Deducts {@code quantity} units, oldest row first.
     *
     * @return one allocation per row touched, in deduction order
     * @throws InsufficientBalanceException if the key has fewer available units
     */
    public List<Allocation> consume(int quantity) {
        requirePositive(quantity);
        requireAvailable(quantity);

        List<Allocation> allocations = new ArrayList<>();
        int remaining = quantity;
        int available = totalAvailable();
        for (EntitlementEntity row : rows) {
            if (remaining == 0) {
                break;
            }
            int take = Math.min(row.getAvailableQuantity(), remaining);
            if (take == 0) {
                continue;
            }
            row.consume(take);
            remaining -= take;
            available -= take;
            allocations.add(new Allocation(row.getId(), take, available));
        }
        return allocations;
    }

    /**
     * Returns consumed units, newest row first.
     *
     * @return the available balance after the restore
     */
    public int restoreConsumed(int quantity) {
        requirePositive(quantity);
        int consumed = totalConsumed();
        if (quantity > consumed) {
            throw new ExceedsConsumedException(serviceType, consumed, quantity);
        }

        int remaining = quantity;
        for (int i = rows.size() - 1; i >= 0 && remaining > 0; i--) {
            EntitlementEntity row = rows.get(i);
            int give = Math.min(row.getConsumedQuantity(), remaining);
            if (give > 0) {
                row.restoreConsumed(give);
                remaining -= give;
            }
        }
        return totalAvailable();
    }

    /**
     * Reserves units for a hold, oldest row first.
     */
    public void hold(int quantity) {
        requirePositive(quantity);
        requireAvailable(quantity);

        int remaining = quantity;
        for (EntitlementEntity row : rows) {
            if (remaining == 0) {
                break;
            }
            int take = Math.min(row.getAvailableQuantity(), remaining);
            if (take > 0) {
                row.hold(take);
                remaining -= take;
            }
        }
    }

    /**
     * Returns held units to the available pool, oldest row first.
     *
     * @throws IllegalStateException if the rows hold fewer units than the hold claims
     */
    public void releaseHeld(int quantity) {
        requirePositive(quantity);
        int held = totalHeld();
        if (quantity > held) {
            throw new IllegalStateException(String.format(
                "Cannot release %d held units of %s for student %s: only %d held",
                quantity, serviceType, studentId, held));
        }

        int remaining = quantity;
        for (EntitlementEntity row : rows) {
            if (remaining == 0) {
                break;
            }
            int give = Math.min(row.getHeldQuantity(), remaining);
            if (give > 0) {
                row.releaseHeld(give);
                remaining -= give;
            }
        }
    }

    /**
     * Applies a signed manual adjustment. Positive deltas grow the first row;
     * negative deltas shrink rows with available units, oldest first.
     *
     * @return the available balance after the adjustment
     * @throws InsufficientBalanceException if the result would be negative
     */
    public int adjust(int delta) {
        if (delta == 0) {
            throw new ValidationException("Adjustment quantity cannot be zero");
        }
        int available = totalAvailable();
        int balanceAfter = available + delta;
        if (balanceAfter < 0) {
            throw new InsufficientBalanceException(serviceType, available, -delta);
        }

        if (delta > 0) {
            rows.get(0).increaseTotal(delta);
            return balanceAfter;
        }

        int remaining = -delta;
        for (EntitlementEntity row : rows) {
            if (remaining == 0) {
                break;
            }
            int take = Math.min(row.getAvailableQuantity(), remaining);
            if (take > 0) {
                row.decreaseTotal(take);
                remaining -= take;
            }
        }
        return balanceAfter;
    }

    /**
     * Adds a freshly granted row to the locked set.
     */
    public void add(EntitlementEntity row) {
        rows.add(row);
    }

    private void requireAvailable(int quantity) {
        int available = totalAvailable();
        if (available < quantity) {
            throw new InsufficientBalanceException(serviceType, available, quantity);
        }
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
