package com.flagship.service_entitlement.hold;

import com.flagship.service_entitlement.hold.dto.CloseHoldRequest;
import com.flagship.service_entitlement.hold.dto.CreateHoldRequest;
import com.flagship.service_entitlement.hold.dto.HoldResponse;
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

@RestController
@RequestMapping("/api/holds")
@RequiredArgsConstructor
public class HoldController {

    private final HoldService holdService;

    @PostMapping
    public ResponseEntity<HoldResponse> createHold(@Valid @RequestBody CreateHoldRequest request) {
        CreateHoldCommand command = new CreateHoldCommand(
            request.contractId(),
            request.studentId(),
            request.serviceType(),
            request.quantity(),
            request.relatedBookingId(),
            request.expiryAt(),
            request.createdBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(HoldResponse.from(holdService.createHold(command)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<HoldResponse> getHold(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(HoldResponse.from(holdService.getHold(id)));
    }

    /**
     * Active holds of a contract, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<HoldResponse>> listActiveHolds(
            @RequestParam("contract_id") UUID contractId,
            @RequestParam(value = "service_type", required = false) String serviceType) {
        return ResponseEntity.ok(holdService.listActiveHolds(contractId, serviceType).stream()
            .map(HoldResponse::from)
            .toList());
    }

    @PostMapping("/{id}/release")
    public ResponseEntity<HoldResponse> releaseHold(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CloseHoldRequest request) {
        return ResponseEntity.ok(HoldResponse.from(holdService.releaseHold(id, request.reason(), request.actor())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<HoldResponse> cancelHold(
            @PathVariable("id") UUID id,
            @Valid @RequestBody CloseHoldRequest request) {
        return ResponseEntity.ok(HoldResponse.from(holdService.cancelHold(id, request.reason(), request.actor())));
    }

    @PostMapping("/{id}/expire")
    public ResponseEntity<HoldResponse> expireHold(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(HoldResponse.from(holdService.expireHold(id)));
    }
}
