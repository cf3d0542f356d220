package com.flagship.savings_circle.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Records money movements and wallet credits.
 *
 * This is an audit trail, not an accounting engine:
 * 1. One row per movement, keyed by a unique reference derived from the payment or cycle
 * 2. Rows are never updated or deleted
 * 3. Re-posting a reference is ignored, so retried settlements cannot double count
 *
 * Wallet balances are stored, and only ever increased here, inside the
 * caller's settlement transaction.
 */
@Service
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public LedgerService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Posts a movement inside the caller's transaction.
     *
     * @return true if written, false if the reference was already posted
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean post(LedgerTransaction transaction) {
        if (transaction.getAmount() < 0) {
            throw new IllegalArgumentException(
                String.format("Transaction %s has negative amount %d", transaction.getReference(), transaction.getAmount()));
        }
        int inserted = jdbcTemplate.update("""
            INSERT INTO transactions (id, reference, user_id, group_id, type, amount, description, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (reference) DO NOTHING
            """,
            UUID.randomUUID(),
            transaction.getReference(),
            transaction.getUserId(),
            transaction.getGroupId(),
            transaction.getType().name(),
            transaction.getAmount(),
            transaction.getDescription(),
            Timestamp.from(clock.instant()));

        if (inserted == 0) {
            log.info("Transaction {} already posted, skipping", transaction.getReference());
            return false;
        }
        log.debug("Posted transaction: reference={}, type={}, amount={}",
            transaction.getReference(), transaction.getType(), transaction.getAmount());
        return true;
    }

    /**
     * Adds {@code amount} to the user's wallet, creating the wallet on first credit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void creditWallet(UUID userId, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Wallet credit cannot be negative: " + amount);
        }
        Timestamp now = Timestamp.from(clock.instant());
        jdbcTemplate.update("""
            INSERT INTO wallets (id, user_id, balance, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (user_id) DO UPDATE
            SET balance = wallets.balance + EXCLUDED.balance, updated_at = EXCLUDED.updated_at
            """,
            UUID.randomUUID(), userId, amount, now, now);
        log.debug("Wallet credited: userId={}, amount={}", userId, amount);
    }

    public long getWalletBalance(UUID userId) {
        List<Long> balances = jdbcTemplate.queryForList(
            "SELECT balance FROM wallets WHERE user_id = ?", Long.class, userId);
        return balances.isEmpty() ? 0L : balances.get(0);
    }

    public List<LedgerTransaction> getTransactionsForGroup(UUID groupId) {
        return jdbcTemplate.query("""
            SELECT reference, user_id, group_id, type, amount, description, created_at
            FROM transactions WHERE group_id = ? ORDER BY created_at, reference
            """,
            transactionRowMapper(),
            groupId);
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getString("reference"),
            rs.getObject("user_id", UUID.class),
            rs.getObject("group_id", UUID.class),
            TransactionType.valueOf(rs.getString("type")),
            rs.getLong("amount"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
