package com.flagship.number_gateway.deposit;

import com.flagship.number_gateway.deposit.dto.CreateDepositRequest;
import com.flagship.number_gateway.deposit.dto.DepositListResponse;
import com.flagship.number_gateway.deposit.dto.DepositResponse;
import com.flagship.number_gateway.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Deposit session endpoints. Webhooks and manual verification are served by the settlement controller.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class DepositController {

    private static final int MAX_PAGE_SIZE = 100;

    private final DepositService depositService;

    @PostMapping("/create-deposit")
    public ResponseEntity<DepositResponse> createDeposit(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @Valid @RequestBody CreateDepositRequest request) {
        log.info("Deposit requested: amount={}, currency={}", request.getAmount(), request.getCurrency());
        PaymentDeposit deposit = depositService.createDeposit(userId, request.getAmount(), request.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(DepositResponse.from(deposit));
    }

    @DeleteMapping("/cancel/{txRef}")
    public ResponseEntity<DepositResponse> cancel(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("txRef") String txRef) {
        return ResponseEntity.ok(DepositResponse.from(depositService.cancelDeposit(userId, txRef)));
    }

    @GetMapping("/status/{txRef}")
    public ResponseEntity<DepositResponse> status(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("txRef") String txRef) {
        return ResponseEntity.ok(DepositResponse.from(depositService.getDeposit(userId, txRef)));
    }

    @GetMapping("/deposits")
    public ResponseEntity<DepositListResponse> list(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        return ResponseEntity.ok(DepositListResponse.from(depositService.listDeposits(userId, page, size)));
    }
}
