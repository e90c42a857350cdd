package com.flagship.service_entitlement.contract;

import java.util.EnumSet;
import java.util.Set;

/**
 * Contract lifecycle states.
 *
 * Allowed transitions:
 * <pre>
 *   DRAFT     -> SIGNED
 *   SIGNED    -> DRAFT, ACTIVE
 *   ACTIVE    -> SUSPENDED, COMPLETED, TERMINATED
 *   SUSPENDED -> ACTIVE, TERMINATED
 * </pre>
 * COMPLETED and TERMINATED are terminal. Entitlements attached to a contract
 * can only be consumed, held or amended while it is ACTIVE.
 */
public enum ContractStatus {
    DRAFT,
    SIGNED,
    ACTIVE,
    SUSPENDED,
    COMPLETED,
    TERMINATED;

    public Set<ContractStatus> allowedTargets() {
        return switch (this) {
            case DRAFT -> EnumSet.of(SIGNED);
            case SIGNED -> EnumSet.of(DRAFT, ACTIVE);
            case ACTIVE -> EnumSet.of(SUSPENDED, COMPLETED, TERMINATED);
            case SUSPENDED -> EnumSet.of(ACTIVE, TERMINATED);
            case COMPLETED, TERMINATED -> EnumSet.noneOf(ContractStatus.class);
        };
    }

    public boolean canTransitionTo(ContractStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    /**
     * Suspension and termination must always say why.
     */
    public static boolean requiresReason(ContractStatus target) {
        return target == SUSPENDED || target == TERMINATED;
    }
}
