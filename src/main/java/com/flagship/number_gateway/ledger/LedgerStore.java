package com.flagship.number_gateway.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Balance accounts and the append-only transaction log.
 *
 * Invariants:
 * 1. A balance never goes negative (conditional UPDATE plus a CHECK constraint)
 * 2. Balance-before and balance-after of a record come from the statement that changed the balance
 * 3. At most one record per (type, reference id), enforced by a unique index
 *
 * Mutating methods require an existing transaction so that a caller cannot debit
 * without also writing the matching record.
 */
@Slf4j
@Service
public class LedgerStore {

    private static final String ACCOUNT_COLUMNS =
        "user_id, balance, total_deposited, total_spent, last_transaction_at";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public LedgerStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Locks the user's account row for the rest of the transaction, creating it if absent.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceAccount lockAccount(String userId) {
        requireUser(userId);
        jdbcTemplate.update(
            "INSERT INTO balance_accounts (user_id) VALUES (?) ON CONFLICT (user_id) DO NOTHING",
            userId
        );
        return jdbcTemplate.queryForObject(
            "SELECT " + ACCOUNT_COLUMNS + " FROM balance_accounts WHERE user_id = ? FOR UPDATE",
            accountRowMapper(),
            userId
        );
    }

    /**
     * Debits the account only if it holds at least {@code amount}.
     *
     * @return the mutation, or empty when the balance was insufficient (nothing changed)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<BalanceMutation> debitIfSufficient(String userId, BigDecimal amount) {
        requireUser(userId);
        requirePositive(amount);
        Timestamp now = Timestamp.from(clock.instant());
        List<BigDecimal> after = jdbcTemplate.query(
            "UPDATE balance_accounts " +
            "SET balance = balance - ?, total_spent = total_spent + ?, last_transaction_at = ?, updated_at = ? " +
            "WHERE user_id = ? AND balance >= ? " +
            "RETURNING balance",
            (rs, rowNum) -> rs.getBigDecimal(1),
            amount, amount, now, now, userId, amount
        );
        if (after.isEmpty()) {
            log.info("Debit refused for insufficient balance: userId={}, amount={}", userId, amount);
            return Optional.empty();
        }
        BigDecimal balanceAfter = after.get(0);
        return Optional.of(new BalanceMutation(userId, amount, balanceAfter.add(amount), balanceAfter));
    }

    /**
     * Adds {@code amount} to the account, creating it if needed. Deposits also raise the deposited total.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceMutation credit(String userId, BigDecimal amount, TransactionType type) {
        requireUser(userId);
        requirePositive(amount);
        if (type == TransactionType.PURCHASE) {
            throw new IllegalArgumentException("A purchase cannot credit a balance");
        }
        BigDecimal deposited = type == TransactionType.DEPOSIT ? amount : BigDecimal.ZERO;
        Timestamp now = Timestamp.from(clock.instant());
        BigDecimal balanceAfter = jdbcTemplate.queryForObject(
            "INSERT INTO balance_accounts (user_id, balance, total_deposited, last_transaction_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?) " +
            "ON CONFLICT (user_id) DO UPDATE SET " +
            "  balance = balance_accounts.balance + EXCLUDED.balance, " +
            "  total_deposited = balance_accounts.total_deposited + EXCLUDED.total_deposited, " +
            "  last_transaction_at = EXCLUDED.last_transaction_at, " +
            "  updated_at = EXCLUDED.updated_at " +
            "RETURNING balance",
            BigDecimal.class,
            userId, amount, deposited, now, now
        );
        return new BalanceMutation(userId, amount, balanceAfter.subtract(amount), balanceAfter);
    }

    /**
     * Appends a record for a mutation. A second record for the same (type, reference) fails with
     * {@link org.springframework.dao.DuplicateKeyException} and rolls the caller back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransactionRecord recordTransaction(TransactionType type, BalanceMutation mutation,
                                               String referenceId, String description) {
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("Reference id is required");
        }
        UUID id = UUID.randomUUID();
        Instant createdAt = clock.instant();
        jdbcTemplate.update(
            "INSERT INTO transaction_records " +
            "(id, user_id, transaction_type, amount, balance_before, balance_after, reference_id, description, status, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, 'COMPLETED', ?)",
            id,
            mutation.getUserId(),
            type.name(),
            mutation.getAmount(),
            mutation.getBalanceBefore(),
            mutation.getBalanceAfter(),
            referenceId,
            description,
            Timestamp.from(createdAt)
        );
        log.info("Ledger record written: type={}, userId={}, amount={}, before={}, after={}, reference={}",
            type, mutation.getUserId(), mutation.getAmount(), mutation.getBalanceBefore(),
            mutation.getBalanceAfter(), referenceId);
        return new TransactionRecord(id, mutation.getUserId(), type, mutation.getAmount(),
            mutation.getBalanceBefore(), mutation.getBalanceAfter(), referenceId, description, "COMPLETED", createdAt);
    }

    /**
     * Reads the account without creating or locking it.
     */
    @Transactional(readOnly = true)
    public BalanceAccount getBalance(String userId) {
        List<BalanceAccount> accounts = jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM balance_accounts WHERE user_id = ?",
            accountRowMapper(),
            userId
        );
        return accounts.isEmpty() ? BalanceAccount.empty(userId) : accounts.get(0);
    }

    @Transactional(readOnly = true)
    public List<TransactionRecord> findTransactions(String userId, int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT id, user_id, transaction_type, amount, balance_before, balance_after, reference_id, " +
            "description, status, created_at FROM transaction_records " +
            "WHERE user_id = ? ORDER BY created_at DESC, id LIMIT ? OFFSET ?",
            transactionRowMapper(),
            userId, limit, offset
        );
    }

    @Transactional(readOnly = true)
    public List<TransactionRecord> findByReference(String referenceId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, transaction_type, amount, balance_before, balance_after, reference_id, " +
            "description, status, created_at FROM transaction_records " +
            "WHERE reference_id = ? ORDER BY created_at",
            transactionRowMapper(),
            referenceId
        );
    }

    private RowMapper<BalanceAccount> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp last = rs.getTimestamp("last_transaction_at");
            return new BalanceAccount(
                rs.getString("user_id"),
                rs.getBigDecimal("balance"),
                rs.getBigDecimal("total_deposited"),
                rs.getBigDecimal("total_spent"),
                last != null ? last.toInstant() : null
            );
        };
    }

    private RowMapper<TransactionRecord> transactionRowMapper() {
        return (rs, rowNum) -> new TransactionRecord(
            UUID.fromString(rs.getString("id")),
            rs.getString("user_id"),
            TransactionType.valueOf(rs.getString("transaction_type")),
            rs.getBigDecimal("amount"),
            rs.getBigDecimal("balance_before"),
            rs.getBigDecimal("balance_after"),
            rs.getString("reference_id"),
            rs.getString("description"),
            rs.getString("status"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }
}
