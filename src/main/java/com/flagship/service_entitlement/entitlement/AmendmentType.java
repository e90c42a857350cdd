package com.flagship.service_entitlement.entitlement;

/**
 * Kinds of grant added to a contract after activation. Each maps to the
 * {@link EntitlementSource} of the row it creates.
 */
public enum AmendmentType {
    ADDON(EntitlementSource.ADDON),
    PROMOTION(EntitlementSource.PROMOTION),
    COMPENSATION(EntitlementSource.COMPENSATION);

    private final EntitlementSource source;

    AmendmentType(EntitlementSource source) {
        this.source = source;
    }

    public EntitlementSource toSource() {
        return source;
    }
}
