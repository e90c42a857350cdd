package com.flagship.service_entitlement.entitlement;

import java.util.List;
import java.util.UUID;

/**
 * Input for {@link AmendmentService#addAmendment}. {@code description} and
 * {@code attachments} are optional.
 */
public record AddAmendmentCommand(
        UUID studentId,
        UUID contractId,
        String serviceType,
        AmendmentType ledgerType,
        int quantityChanged,
        String reason,
        String description,
        List<String> attachments,
        String createdBy) {
}
