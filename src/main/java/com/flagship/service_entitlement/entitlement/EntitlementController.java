package com.flagship.service_entitlement.entitlement;

import com.flagship.service_entitlement.entitlement.dto.AddAmendmentRequest;
import com.flagship.service_entitlement.entitlement.dto.AmendmentResponse;
import com.flagship.service_entitlement.entitlement.dto.BalanceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Balances per student and the amendments granted on top of contracts.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EntitlementController {

    private final BalanceService balanceService;
    private final AmendmentService amendmentService;

    @GetMapping("/students/{studentId}/balances")
    public ResponseEntity<List<BalanceResponse>> getBalances(
            @PathVariable("studentId") UUID studentId,
            @RequestParam(value = "service_type", required = false) String serviceType) {

        return ResponseEntity.ok(balanceService.getBalances(studentId, serviceType).stream()
            .map(BalanceResponse::from)
            .toList());
    }

    @GetMapping("/students/{studentId}/amendments")
    public ResponseEntity<List<AmendmentResponse>> listAmendments(@PathVariable("studentId") UUID studentId) {
        return ResponseEntity.ok(amendmentService.listAmendments(studentId).stream()
            .map(AmendmentResponse::from)
            .toList());
    }

    @PostMapping("/contracts/{contractId}/amendments")
    public ResponseEntity<AmendmentResponse> addAmendment(
            @PathVariable("contractId") UUID contractId,
            @Valid @RequestBody AddAmendmentRequest request) {

        AddAmendmentCommand command = new AddAmendmentCommand(
            request.studentId(),
            contractId,
            request.serviceType(),
            request.ledgerType(),
            request.quantityChanged(),
            request.reason(),
            request.description(),
            request.attachments(),
            request.createdBy()
        );
        ContractAmendment amendment = amendmentService.addAmendment(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(AmendmentResponse.from(amendment));
    }
}
