package com.flagship.number_gateway.ledger;

import com.flagship.number_gateway.ledger.dto.BalanceResponse;
import com.flagship.number_gateway.ledger.dto.TransactionResponse;
import com.flagship.number_gateway.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of a user's balance and transaction history.
 */
@RestController
@RequestMapping("/api/balance")
@RequiredArgsConstructor
public class BalanceController {

    private static final int MAX_LIMIT = 100;

    private final LedgerStore ledgerStore;

    @GetMapping
    public ResponseEntity<BalanceResponse> getBalance(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) String userId,
            @RequestParam(name = "limit", defaultValue = "10") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        if (limit < 1 || limit > MAX_LIMIT || offset < 0) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + " and offset >= 0");
        }
        BalanceAccount account = ledgerStore.getBalance(userId);
        List<TransactionResponse> transactions = ledgerStore.findTransactions(userId, limit, offset).stream()
            .map(TransactionResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(BalanceResponse.from(account, transactions));
    }
}
