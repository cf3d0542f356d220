package com.flagship.savings_circle.payment;

import com.flagship.savings_circle.config.SettlementProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * System of record for "did this payment happen and was it verified".
 *
 * Key principles:
 * - The reference is the idempotency anchor; the first writer wins
 * - Every transition is a conditional UPDATE whose row count tells the caller if it won
 * - Downstream actors re-read state from here instead of trusting caller-supplied flags
 *
 * Plain JDBC: the guarantees come from the statements themselves, not from an ORM session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedger {

    public static final String REVIEW_AMOUNT_MISMATCH = "AMOUNT_MISMATCH";
    public static final String REVIEW_DUPLICATE_ENTRY = "DUPLICATE_ENTRY";
    public static final String REVIEW_DUPLICATE_PAYMENT = "DUPLICATE_PAYMENT";
    public static final String REVIEW_ACTIVATION_FAILED = "ACTIVATION_FAILED";
    public static final String REVIEW_SETTLEMENT_FAILED = "SETTLEMENT_FAILED";

    private static final String SELECT_COLUMNS = """
        SELECT reference, idempotency_key, purpose, group_id, user_id, slot_preference,
               contribution_id, cycle_number, expected_amount, gateway_amount, currency,
               verification_status, processed, review_reason, verified_at, processed_at, created_at
        FROM payment_records
        """;

    private final JdbcTemplate jdbcTemplate;
    private final SettlementProperties settlementProperties;
    private final Clock clock;

    /**
     * Inserts a PENDING record, or returns the existing one unchanged.
     *
     * A conflicting idempotency key also counts as "already recorded": the
     * record that owns the key is returned instead.
     */
    @Transactional
    public PaymentRecord recordAttempt(String reference, long amount, PaymentPurpose purpose, String idempotencyKey) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Payment reference cannot be blank");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }

        Integer slotPreference = null;
        UUID contributionId = null;
        Integer cycleNumber = null;
        if (purpose instanceof EntryPayment entry) {
            slotPreference = entry.preferredSlot();
        } else if (purpose instanceof RecurringContribution contribution) {
            contributionId = contribution.contributionId();
            cycleNumber = contribution.cycleNumber();
        }

        Timestamp now = Timestamp.from(clock.instant());
        int inserted = jdbcTemplate.update("""
            INSERT INTO payment_records (id, reference, idempotency_key, purpose, group_id, user_id,
                slot_preference, contribution_id, cycle_number, expected_amount, currency,
                verification_status, processed, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 'PENDING', FALSE, ?, ?)
            ON CONFLICT DO NOTHING
            """,
            UUID.randomUUID(), reference, idempotencyKey, purpose.type().name(),
            purpose.groupId(), purpose.userId(), slotPreference, contributionId, cycleNumber,
            amount, settlementProperties.getCurrency(), now, now);

        if (inserted == 1) {
            log.info("Payment attempt recorded: reference={}, purpose={}, amount={}",
                reference, purpose.type(), amount);
        } else {
            log.info("Payment attempt already recorded, returning existing: reference={}", reference);
        }

        return findByReference(reference)
            .or(() -> idempotencyKey != null ? findByIdempotencyKey(idempotencyKey) : Optional.empty())
            .orElseThrow(() -> new IllegalStateException("Payment record vanished after insert: " + reference));
    }

    @Transactional(readOnly = true)
    public Optional<PaymentRecord> findByReference(String reference) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE reference = ?", recordRowMapper(), reference)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<PaymentRecord> findByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE idempotency_key = ?", recordRowMapper(), idempotencyKey)
            .stream()
            .findFirst();
    }

    public PaymentRecord getByReference(String reference) {
        return findByReference(reference).orElseThrow(() -> new PaymentNotFoundException(reference));
    }

    /**
     * Records the gateway's verdict. Only a PENDING record changes; later calls are no-ops.
     *
     * A successful charge for the wrong amount, or in another currency, fails the
     * record, flags it for review, commits, and then throws.
     *
     * @param gatewayCurrency currency the gateway charged in, or null when it reported none
     * @throws AmountMismatchException if the gateway amount or currency differs from the expected one
     */
    @Transactional(noRollbackFor = AmountMismatchException.class)
    public PaymentRecord markVerified(String reference, long gatewayAmount, String gatewayCurrency,
                                      GatewayStatus gatewayStatus) {
        if (gatewayStatus == GatewayStatus.IN_PROGRESS) {
            throw new IllegalArgumentException("Cannot record an in-progress charge as a verdict: " + reference);
        }
        PaymentRecord record = getByReference(reference);
        if (!record.isPending()) {
            log.debug("Payment {} already {}, ignoring gateway verdict {}",
                reference, record.getVerificationStatus(), gatewayStatus);
            return record;
        }

        boolean currencyMismatch = gatewayStatus == GatewayStatus.SUCCESS
            && (gatewayCurrency == null || !gatewayCurrency.equalsIgnoreCase(record.getCurrency()));
        boolean mismatch = gatewayStatus == GatewayStatus.SUCCESS
            && (currencyMismatch || gatewayAmount != record.getExpectedAmount());
        VerificationStatus target = gatewayStatus == GatewayStatus.SUCCESS && !mismatch
            ? VerificationStatus.VERIFIED
            : VerificationStatus.FAILED;
        String reviewReason = null;
        if (currencyMismatch) {
            reviewReason = String.format("%s: expected %d %s, gateway %d %s", REVIEW_AMOUNT_MISMATCH,
                record.getExpectedAmount(), record.getCurrency(), gatewayAmount, gatewayCurrency);
        } else if (mismatch) {
            reviewReason = String.format("%s: expected %d, gateway %d",
                REVIEW_AMOUNT_MISMATCH, record.getExpectedAmount(), gatewayAmount);
        }

        Timestamp now = Timestamp.from(clock.instant());
        int updated = jdbcTemplate.update("""
            UPDATE payment_records
            SET verification_status = ?, gateway_amount = ?, review_reason = ?, verified_at = ?, updated_at = ?
            WHERE reference = ? AND verification_status = 'PENDING'
            """,
            target.name(), gatewayAmount, reviewReason, now, now, reference);

        if (updated == 0) {
            log.info("Payment {} was verified concurrently, keeping existing verdict", reference);
            return getByReference(reference);
        }

        log.info("Payment verification recorded: reference={}, status={}, gatewayAmount={}",
            reference, target, gatewayAmount);

        if (mismatch) {
            log.warn("Payment {} flagged for review: {}", reference, reviewReason);
            throw currencyMismatch
                ? new AmountMismatchException(reference, record.getExpectedAmount(), record.getCurrency(),
                    gatewayAmount, gatewayCurrency)
                : new AmountMismatchException(reference, record.getExpectedAmount(), gatewayAmount);
        }
        return getByReference(reference);
    }

    /**
     * Claims the right to apply this reference's side effects.
     *
     * Must run inside the transaction that applies them: the claim and the
     * side effects commit or roll back together, and a concurrent caller
     * blocks on the row until then and sees {@code false}.
     *
     * @return true if this caller flipped processed from false to true
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean markProcessed(String reference) {
        Timestamp now = Timestamp.from(clock.instant());
        int updated = jdbcTemplate.update("""
            UPDATE payment_records
            SET processed = TRUE, processed_at = ?, updated_at = ?,
                review_reason = CASE WHEN review_reason LIKE ? OR review_reason LIKE ? THEN NULL ELSE review_reason END
            WHERE reference = ? AND processed = FALSE AND verification_status = 'VERIFIED'
            """,
            now, now, REVIEW_ACTIVATION_FAILED + "%", REVIEW_SETTLEMENT_FAILED + "%", reference);
        return updated == 1;
    }

    /**
     * Same as {@link #flagForReview} but inside the caller's transaction, for
     * callers that already hold the record's row lock through {@link #markProcessed}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void noteReviewReason(String reference, String reason) {
        jdbcTemplate.update(
            "UPDATE payment_records SET review_reason = ?, updated_at = ? WHERE reference = ?",
            truncate(reason), Timestamp.from(clock.instant()), reference);
        log.warn("Payment {} flagged for review: {}", reference, reason);
    }

    /**
     * Flags a record for operator attention in a transaction of its own, so the
     * flag survives the rollback of whatever failed.
     *
     * Never call this while holding the record's row lock: the new transaction would wait on it.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void flagForReview(String reference, String reason) {
        jdbcTemplate.update(
            "UPDATE payment_records SET review_reason = ?, updated_at = ? WHERE reference = ?",
            truncate(reason), Timestamp.from(clock.instant()), reference);
        log.warn("Payment {} flagged for review: {}", reference, reason);
    }

    /**
     * Records that still need work: PENDING ones older than the cutoff, and
     * VERIFIED ones whose side effects never ran. A VERIFIED record flagged for
     * anything other than a failed settlement attempt is left to an operator.
     */
    @Transactional(readOnly = true)
    public List<PaymentRecord> findReconcilable(Instant pendingBefore, int limit) {
        return jdbcTemplate.query(SELECT_COLUMNS + """
             WHERE (verification_status = 'PENDING' AND created_at < ?)
                OR (verification_status = 'VERIFIED' AND processed = FALSE
                    AND (review_reason IS NULL OR review_reason LIKE ? OR review_reason LIKE ?))
             ORDER BY created_at ASC
             LIMIT ?
            """,
            recordRowMapper(), Timestamp.from(pendingBefore),
            REVIEW_ACTIVATION_FAILED + "%", REVIEW_SETTLEMENT_FAILED + "%", limit);
    }

    @Transactional(readOnly = true)
    public long countFlaggedForReview() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM payment_records WHERE review_reason IS NOT NULL", Long.class);
        return count != null ? count : 0L;
    }

    private String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > 500 ? reason.substring(0, 500) : reason;
    }

    private RowMapper<PaymentRecord> recordRowMapper() {
        return (rs, rowNum) -> new PaymentRecord(
            rs.getString("reference"),
            rs.getString("idempotency_key"),
            mapPurpose(rs),
            rs.getLong("expected_amount"),
            rs.getObject("gateway_amount", Long.class),
            rs.getString("currency"),
            VerificationStatus.valueOf(rs.getString("verification_status")),
            rs.getBoolean("processed"),
            rs.getString("review_reason"),
            toInstant(rs.getTimestamp("verified_at")),
            toInstant(rs.getTimestamp("processed_at")),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private PaymentPurpose mapPurpose(ResultSet rs) throws SQLException {
        UUID groupId = rs.getObject("group_id", UUID.class);
        UUID userId = rs.getObject("user_id", UUID.class);
        return switch (PurposeType.valueOf(rs.getString("purpose"))) {
            case ENTRY_PAYMENT -> new EntryPayment(groupId, userId, rs.getObject("slot_preference", Integer.class));
            case RECURRING_CONTRIBUTION -> new RecurringContribution(
                groupId, userId, rs.getObject("contribution_id", UUID.class), rs.getInt("cycle_number"));
        };
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
