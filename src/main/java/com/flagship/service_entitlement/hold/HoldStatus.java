package com.flagship.service_entitlement.hold;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reservation hold states. ACTIVE is the only non-terminal state.
 */
public enum HoldStatus {
    ACTIVE,
    RELEASED,
    CANCELLED,
    EXPIRED;

    public Set<HoldStatus> allowedTargets() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(RELEASED, CANCELLED, EXPIRED);
            case RELEASED, CANCELLED, EXPIRED -> EnumSet.noneOf(HoldStatus.class);
        };
    }

    public boolean canTransitionTo(HoldStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }
}
