package com.flagship.number_gateway.settlement;

import com.flagship.number_gateway.observability.CorrelationContext;
import com.flagship.number_gateway.settlement.dto.VerificationResponse;
import com.flagship.number_gateway.settlement.dto.WebhookAckResponse;
import com.flagship.number_gateway.settlement.dto.WebhookLogResponse;
import com.flagship.number_gateway.settlement.dto.WebhookStatsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Payment webhook, manual verification and the operator views of the webhook log.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    static final String VERIF_HASH_HEADER = "verif-hash";

    private static final int MAX_PAGE_SIZE = 100;
    private static final Duration STATS_WINDOW = Duration.ofHours(24);

    private final WebhookSettlementEngine settlementEngine;
    private final ManualVerificationService verificationService;
    private final WebhookLogService logService;

    /**
     * Answers 200 whenever the receipt was logged, including for a bad signature.
     */
    @PostMapping("/webhook")
    public ResponseEntity<WebhookAckResponse> webhook(
            @RequestBody byte[] body,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(name = VERIF_HASH_HEADER, required = false) String verifHash) {
        WebhookReceipt receipt = settlementEngine.receive(body, signature, verifHash);
        return ResponseEntity.ok(WebhookAckResponse.from(receipt));
    }

    @PostMapping("/verify/{txRef}")
    public ResponseEntity<VerificationResponse> verify(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @PathVariable("txRef") String txRef) {
        log.info("Manual verification requested: txRef={}", txRef);
        return ResponseEntity.ok(VerificationResponse.from(verificationService.verify(userId, txRef)));
    }

    @GetMapping("/webhook/logs")
    public ResponseEntity<List<WebhookLogResponse>> logs(
            @RequestParam(name = "tx_ref", required = false) String txRef,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        List<WebhookLogResponse> entries = logService.list(txRef, page, size).getContent().stream()
            .map(WebhookLogResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/webhook/stats")
    public ResponseEntity<WebhookStatsResponse> stats() {
        return ResponseEntity.ok(WebhookStatsResponse.from(logService.stats(STATS_WINDOW)));
    }
}
