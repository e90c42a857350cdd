package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.contract.dto.ContractHistoryResponse;
import com.flagship.service_entitlement.contract.dto.ContractResponse;
import com.flagship.service_entitlement.contract.dto.CreateContractRequest;
import com.flagship.service_entitlement.contract.dto.TransitionContractRequest;
import com.flagship.service_entitlement.contract.dto.UpdateContractRequest;
import com.flagship.service_entitlement.exception.ValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the contract lifecycle.
 *
 * Creation requires an Idempotency-Key header: the first call answers 201, a
 * repeated key answers 200 with the contract created the first time.
 */
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
@Slf4j
public class ContractController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ContractService contractService;

    @PostMapping
    public ResponseEntity<ContractResponse> createContract(
            @Valid @RequestBody CreateContractRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received contract creation request: idempotencyKey={}, studentId={}, productId={}",
                idempotencyKey, request.studentId(), request.productId());

        if (idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency-Key must not be blank");
        }

        CreateContractCommand command = new CreateContractCommand(
            request.studentId(),
            request.productId(),
            request.title(),
            request.totalAmount(),
            parseCurrency(request.currency()),
            request.validityDays(),
            request.createdBy()
        );
        ContractCreationResult result = contractService.createContract(command, idempotencyKey);

        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(ContractResponse.from(result.contract()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContractResponse> getContract(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ContractResponse.from(contractService.getContract(id)));
    }

    @GetMapping
    public ResponseEntity<List<ContractResponse>> listContracts(@RequestParam("student_id") UUID studentId) {
        return ResponseEntity.ok(contractService.listContracts(studentId).stream()
            .map(ContractResponse::from)
            .toList());
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ContractResponse> updateContract(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateContractRequest request) {

        ContractCoreUpdate update = new ContractCoreUpdate(
            request.title(),
            request.totalAmount(),
            request.currency() == null ? null : parseCurrency(request.currency()),
            request.validityDays()
        );
        Contract updated = contractService.updateCoreFields(id, update, request.updatedBy());
        return ResponseEntity.ok(ContractResponse.from(updated));
    }

    @PostMapping("/{id}/transitions")
    public ResponseEntity<ContractResponse> transitionStatus(
            @PathVariable("id") UUID id,
            @Valid @RequestBody TransitionContractRequest request) {

        Contract contract = contractService.transitionStatus(
            id, request.targetStatus(), request.reason(), request.actorId());
        return ResponseEntity.ok(ContractResponse.from(contract));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<List<ContractHistoryResponse>> getStatusHistory(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(contractService.getStatusHistory(id).stream()
            .map(ContractHistoryResponse::from)
            .toList());
    }

    private static CurrencyCode parseCurrency(String currency) {
        try {
            return CurrencyCode.valueOf(currency.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unsupported currency code: " + currency);
        }
    }
}
