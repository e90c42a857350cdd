package com.flagship.service_entitlement.ledger;

import com.flagship.service_entitlement.ledger.dto.AdjustmentRequest;
import com.flagship.service_entitlement.ledger.dto.ArchivePolicyResponse;
import com.flagship.service_entitlement.ledger.dto.ConsumeRequest;
import com.flagship.service_entitlement.ledger.dto.ConsumeResponse;
import com.flagship.service_entitlement.ledger.dto.CreateArchivePolicyRequest;
import com.flagship.service_entitlement.ledger.dto.LedgerEntryResponse;
import com.flagship.service_entitlement.ledger.dto.LedgerPageResponse;
import com.flagship.service_entitlement.ledger.dto.ReconciliationResponse;
import com.flagship.service_entitlement.ledger.dto.RefundRequest;
import com.flagship.service_entitlement.ledger.dto.UpdateArchivePolicyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for ledger writes, ledger queries, reconciliation and archive policies.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerService ledgerService;
    private final LedgerQueryService queryService;
    private final ReconciliationService reconciliationService;
    private final LedgerArchiveService archiveService;

    @PostMapping("/consumptions")
    public ResponseEntity<ConsumeResponse> recordConsumption(@Valid @RequestBody ConsumeRequest request) {
        ConsumeCommand command = new ConsumeCommand(
            request.studentId(),
            request.serviceType(),
            request.quantity(),
            request.relatedBookingId(),
            request.bookingSource(),
            request.relatedHoldId(),
            request.contractId(),
            request.createdBy()
        );
        List<LedgerEntry> entries = ledgerService.recordConsumption(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(ConsumeResponse.from(entries));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<LedgerEntryResponse> recordAdjustment(@Valid @RequestBody AdjustmentRequest request) {
        LedgerEntry entry = ledgerService.recordAdjustment(request.studentId(), request.serviceType(),
            request.quantity(), request.reason(), request.createdBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @PostMapping("/refunds")
    public ResponseEntity<LedgerEntryResponse> recordRefund(@Valid @RequestBody RefundRequest request) {
        RefundCommand command = new RefundCommand(
            request.studentId(),
            request.serviceType(),
            request.quantity(),
            request.relatedBookingId(),
            request.bookingSource(),
            request.reason(),
            request.createdBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(LedgerEntryResponse.from(ledgerService.recordRefund(command)));
    }

    @GetMapping
    public ResponseEntity<LedgerPageResponse> queryLedger(
            @RequestParam(value = "student_id", required = false) UUID studentId,
            @RequestParam(value = "service_type", required = false) String serviceType,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "include_archive", defaultValue = "false") boolean includeArchive,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {

        List<LedgerEntry> entries = queryService.queryLedger(
            new LedgerFilter(studentId, serviceType, from, to), includeArchive, limit, offset);

        return ResponseEntity.ok(LedgerPageResponse.builder()
            .entries(entries.stream().map(LedgerEntryResponse::from).toList())
            .includeArchive(includeArchive)
            .limit(limit == null ? LedgerQueryService.DEFAULT_LIMIT : limit)
            .offset(offset == null ? 0 : offset)
            .build());
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @RequestParam("student_id") UUID studentId,
            @RequestParam("service_type") String serviceType) {
        return ResponseEntity.ok(ReconciliationResponse.from(reconciliationService.reconcile(studentId, serviceType)));
    }

    @GetMapping("/archive-policies")
    public ResponseEntity<List<ArchivePolicyResponse>> listArchivePolicies() {
        return ResponseEntity.ok(archiveService.listPolicies().stream()
            .map(ArchivePolicyResponse::from)
            .toList());
    }

    @PostMapping("/archive-policies")
    public ResponseEntity<ArchivePolicyResponse> createArchivePolicy(
            @Valid @RequestBody CreateArchivePolicyRequest request) {
        ArchivePolicyCommand command = new ArchivePolicyCommand(
            request.scope(),
            request.serviceType(),
            request.archiveAfterDays(),
            Boolean.TRUE.equals(request.deleteAfterArchive()),
            request.enabled() == null || request.enabled(),
            request.createdBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ArchivePolicyResponse.from(archiveService.createPolicy(command)));
    }

    @PatchMapping("/archive-policies/{id}")
    public ResponseEntity<ArchivePolicyResponse> updateArchivePolicy(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateArchivePolicyRequest request) {
        LedgerArchivePolicyEntity updated = archiveService.updatePolicy(
            id, request.archiveAfterDays(), request.deleteAfterArchive(), request.enabled());
        return ResponseEntity.ok(ArchivePolicyResponse.from(updated));
    }
}
