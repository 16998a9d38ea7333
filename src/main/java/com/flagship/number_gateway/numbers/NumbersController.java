package com.flagship.number_gateway.numbers;

import com.flagship.number_gateway.numbers.dto.FullSmsResponse;
import com.flagship.number_gateway.numbers.dto.NumberHistoryResponse;
import com.flagship.number_gateway.numbers.dto.NumberOperationResponse;
import com.flagship.number_gateway.numbers.dto.NumberResponse;
import com.flagship.number_gateway.numbers.dto.PurchaseNumberRequest;
import com.flagship.number_gateway.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST endpoints for leasing and managing virtual numbers.
 *
 * The caller is identified by the {@code X-User-Id} header supplied by the upstream auth layer.
 */
@RestController
@RequestMapping("/api/numbers")
@RequiredArgsConstructor
@Slf4j
public class NumbersController {

    private static final int MAX_PAGE_SIZE = 100;

    private final PurchaseOrchestrator orchestrator;

    @PostMapping("/purchase")
    public ResponseEntity<NumberOperationResponse> purchase(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @Valid @RequestBody PurchaseNumberRequest request) {
        log.info("Purchase requested: service={}, country={}, operator={}, maxPrice={}",
                request.getService(), request.getCountry(), request.getOperator(), request.getMaxPrice());

        PurchaseOutcome outcome = orchestrator.purchase(userId, request.getService(), request.getCountry(),
                request.getOperator(), request.getMaxPrice());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(NumberOperationResponse.from(outcome, "Number purchased successfully"));
    }

    @GetMapping("/active")
    public ResponseEntity<List<NumberResponse>> active(@RequestHeader(CorrelationContext.USER_ID_HEADER) String userId) {
        List<NumberResponse> numbers = orchestrator.getActiveNumbers(userId).stream()
            .map(NumberResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(numbers);
    }

    @GetMapping("/history")
    public ResponseEntity<NumberHistoryResponse> history(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        return ResponseEntity.ok(NumberHistoryResponse.from(orchestrator.getHistory(userId, page, size)));
    }

    @GetMapping("/{activationId}/status")
    public ResponseEntity<NumberResponse> status(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("activationId") String activationId) {
        return ResponseEntity.ok(NumberResponse.from(orchestrator.syncStatus(userId, activationId)));
    }

    @PostMapping("/{activationId}/cancel")
    public ResponseEntity<NumberOperationResponse> cancel(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("activationId") String activationId) {
        PurchaseOutcome outcome = orchestrator.cancel(userId, activationId);
        return ResponseEntity.ok(NumberOperationResponse.from(outcome, "Number cancelled"));
    }

    @PostMapping("/{activationId}/complete")
    public ResponseEntity<NumberOperationResponse> complete(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("activationId") String activationId) {
        PurchaseOutcome outcome = orchestrator.complete(userId, activationId);
        return ResponseEntity.ok(NumberOperationResponse.from(outcome, "Activation completed"));
    }

    @PostMapping("/{activationId}/retry")
    public ResponseEntity<NumberOperationResponse> retry(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("activationId") String activationId) {
        PurchaseOutcome outcome = orchestrator.retry(userId, activationId);
        return ResponseEntity.ok(NumberOperationResponse.from(outcome, "Another SMS requested"));
    }

    @GetMapping("/{activationId}/full-sms")
    public ResponseEntity<FullSmsResponse> fullSms(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("activationId") String activationId) {
        return ResponseEntity.ok(new FullSmsResponse(activationId, orchestrator.getFullSms(userId, activationId)));
    }
}
