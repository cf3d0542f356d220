package com.flagship.savings_circle.failure;

import com.flagship.savings_circle.cycle.ContributionEntity;
import com.flagship.savings_circle.cycle.ContributionRepository;
import com.flagship.savings_circle.cycle.ContributionStatus;
import com.flagship.savings_circle.cycle.CycleScheduler;
import com.flagship.savings_circle.gateway.GatewayUnreachableException;
import com.flagship.savings_circle.gateway.GatewayVerification;
import com.flagship.savings_circle.gateway.TransactionNotFoundException;
import com.flagship.savings_circle.group.Frequency;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.membership.MembershipRepository;
import com.flagship.savings_circle.payment.GatewayStatus;
import com.flagship.savings_circle.payment.PaymentLedger;
import com.flagship.savings_circle.payment.PaymentRecord;
import com.flagship.savings_circle.payment.SettlementResult;
import com.flagship.savings_circle.payment.VerificationStatus;
import com.flagship.savings_circle.scheduling.ScanReport;
import com.flagship.savings_circle.scheduling.ScanTask;
import com.flagship.savings_circle.scheduling.ScheduledScanService;
import com.flagship.savings_circle.support.AbstractIntegrationTest;
import com.flagship.savings_circle.verification.VerificationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Failure scenario tests.
 *
 * Covers:
 * 1. Gateway failures (unreachable, declined, unknown reference, wrong amount)
 * 2. Settlement failures after a successful verification
 * 3. Duplicate payments for something already paid
 * 4. Reconciliation of payments nobody verified
 */
class FailureScenarioTest extends AbstractIntegrationTest {

    @Autowired
    private MembershipRepository membershipRepository;

    @Autowired
    private ContributionRepository contributionRepository;

    @Autowired
    private CycleScheduler cycleScheduler;

    @Autowired
    private ScheduledScanService scanService;

    @Nested
    @DisplayName("1. Gateway Failure Scenarios")
    class GatewayFailures {

        @Test
        @DisplayName("1.1 Unreachable gateway leaves the payment pending")
        void testGatewayUnreachable_StaysPending() {
            printTestHeader("1.1 Gateway Unreachable");

            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            PaymentRecord entry = initiateEntry(group.getId(), UUID.randomUUID(), null);
            when(gatewayClient.verify(anyString()))
                .thenThrow(new GatewayUnreachableException("connection refused", null));

            SettlementResult result = settlementService.verifyAndSettle(entry.getReference());
            printOutput("Status", result.getStatus());
            printOutput("Verification", result.getVerification());

            assertEquals(SettlementResult.Status.NOT_VERIFIED, result.getStatus());
            assertEquals(VerificationOutcome.PENDING, result.getVerification());
            assertTrue(paymentLedger.getByReference(entry.getReference()).isPending());
            verify(gatewayClient, times(3)).verify(entry.getReference());

            printSuccess("Payment left pending after three attempts");
        }

        @Test
        @DisplayName("1.2 Declined charge fails the payment once and for all")
        void testGatewayDeclined_Fails() {
            printTestHeader("1.2 Gateway Declined");

            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            UUID userId = UUID.randomUUID();
            PaymentRecord entry = initiateEntry(group.getId(), userId, null);
            when(gatewayClient.verify(anyString())).thenReturn(
                new GatewayVerification(entry.getReference(), GatewayStatus.FAILED, 0, "NGN", "Declined"));

            SettlementResult first = settlementService.verifyAndSettle(entry.getReference());
            SettlementResult second = settlementService.verifyAndSettle(entry.getReference());

            assertEquals(VerificationOutcome.FAILED, first.getVerification());
            assertEquals(VerificationOutcome.FAILED, second.getVerification());
            assertEquals(VerificationStatus.FAILED,
                paymentLedger.getByReference(entry.getReference()).getVerificationStatus());
            assertTrue(membershipRepository.findByGroupIdAndUserId(group.getId(), userId).isEmpty());
            verify(gatewayClient, times(1)).verify(entry.getReference());

            printSuccess("Verdict recorded once, gateway not asked again");
        }

        @Test
        @DisplayName("1.3 Reference unknown to the gateway fails the payment")
        void testGatewayUnknownReference_Fails() {
            printTestHeader("1.3 Unknown Reference");

            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            PaymentRecord entry = initiateEntry(group.getId(), UUID.randomUUID(), null);
            when(gatewayClient.verify(anyString()))
                .thenThrow(new TransactionNotFoundException(entry.getReference()));

            SettlementResult result = settlementService.verifyAndSettle(entry.getReference());

            assertEquals(VerificationOutcome.FAILED, result.getVerification());
            assertEquals(VerificationStatus.FAILED,
                paymentLedger.getByReference(entry.getReference()).getVerificationStatus());

            printSuccess("Unknown reference failed");
        }

        @Test
        @DisplayName("1.4 Wrong amount flags the payment and applies nothing")
        void testAmountMismatch_Flagged() {
            printTestHeader("1.4 Amount Mismatch");

            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            UUID userId = UUID.randomUUID();
            PaymentRecord entry = initiateEntry(group.getId(), userId, null);
            printInput("Expected", entry.getExpectedAmount());
            when(gatewayClient.verify(anyString())).thenReturn(
                new GatewayVerification(entry.getReference(), GatewayStatus.SUCCESS, 500, "NGN", "Approved"));

            SettlementResult result = settlementService.verifyAndSettle(entry.getReference());
            PaymentRecord record = paymentLedger.getByReference(entry.getReference());
            printOutput("Review reason", record.getReviewReason());

            assertEquals(VerificationOutcome.AMOUNT_MISMATCH, result.getVerification());
            assertEquals(VerificationStatus.FAILED, record.getVerificationStatus());
            assertEquals(500L, record.getGatewayAmount());
            assertTrue(record.getReviewReason().startsWith(PaymentLedger.REVIEW_AMOUNT_MISMATCH));
            assertFalse(record.isProcessed());
            assertTrue(membershipRepository.findByGroupIdAndUserId(group.getId(), userId).isEmpty());

            // A second verification reads the stored verdict
            assertEquals(VerificationOutcome.AMOUNT_MISMATCH,
                settlementService.verifyAndSettle(entry.getReference()).getVerification());

            printSuccess("Mismatch flagged for review");
        }
    }

    @Nested
    @DisplayName("2. Settlement Failure Scenarios")
    class SettlementFailures {

        @Test
        @DisplayName("2.1 Activation failure flags the payment and leaves it unprocessed")
        void testActivationFailure_Flagged() {
            printTestHeader("2.1 Activation Failure");

            gatewayPaysInFull();
            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            UUID userId = UUID.randomUUID();
            PaymentRecord entry = initiateEntry(group.getId(), userId, null);
            groupService.cancel(group.getId());

            assertThrows(IllegalStateException.class, () -> settlementService.verifyAndSettle(entry.getReference()));

            PaymentRecord record = paymentLedger.getByReference(entry.getReference());
            printOutput("Review reason", record.getReviewReason());
            assertTrue(record.isVerified());
            assertFalse(record.isProcessed());
            assertTrue(record.getReviewReason().startsWith(PaymentLedger.REVIEW_ACTIVATION_FAILED + ": "));
            assertTrue(membershipRepository.findByGroupIdAndUserId(group.getId(), userId).isEmpty(),
                "Rolled back activation should leave no membership");
            assertEquals(0, groupService.getGroup(group.getId()).getCurrentMemberCount());

            printSuccess("Payment flagged, nothing applied");
        }

        @Test
        @DisplayName("2.2 Failed activation is applied by reconciliation once the group accepts members again")
        void testActivationFailure_RecoveredByReconciliation() {
            printTestHeader("2.2 Activation Recovery");

            gatewayPaysInFull();
            clock.set(Instant.parse("2020-01-01T00:00:00Z"));
            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            UUID userId = UUID.randomUUID();
            PaymentRecord entry = initiateEntry(group.getId(), userId, 2);

            groupService.pause(group.getId());
            assertThrows(IllegalStateException.class, () -> settlementService.verifyAndSettle(entry.getReference()));
            assertFalse(paymentLedger.getByReference(entry.getReference()).isProcessed());

            groupService.resume(group.getId());
            clock.advance(Duration.ofMinutes(15));
            ScanReport report = scanService.run(null, EnumSet.of(ScanTask.RECONCILE));
            printOutput("Report", report);

            PaymentRecord record = paymentLedger.getByReference(entry.getReference());
            assertTrue(record.isProcessed());
            assertNull(record.getReviewReason(), "Settlement-failure flag should clear once applied");
            assertTrue(report.getPaymentsSettled() >= 1);
            assertEquals(2, membershipRepository.findByGroupIdAndUserId(group.getId(), userId)
                .orElseThrow().getSlotNumber());

            printSuccess("Reconciliation activated the membership on the same slot");
        }
    }

    @Nested
    @DisplayName("3. Duplicate Payment Scenarios")
    class DuplicatePayments {

        @Test
        @DisplayName("3.1 Second entry payment from an active member is flagged for refund")
        void testDuplicateEntry_Flagged() {
            printTestHeader("3.1 Duplicate Entry");

            gatewayPaysInFull();
            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            UUID userId = UUID.randomUUID();
            PaymentRecord first = initiateEntry(group.getId(), userId, 1);
            PaymentRecord second = initiateEntry(group.getId(), userId, 2);

            SettlementResult applied = settlementService.verifyAndSettle(first.getReference());
            SettlementResult duplicate = settlementService.verifyAndSettle(second.getReference());
            printOutput("Second status", duplicate.getStatus());

            assertEquals(SettlementResult.Status.MEMBERSHIP_ACTIVATED, applied.getStatus());
            assertEquals(SettlementResult.Status.FLAGGED_FOR_REVIEW, duplicate.getStatus());
            assertEquals(1, duplicate.getSlotNumber());
            PaymentRecord record = paymentLedger.getByReference(second.getReference());
            assertTrue(record.isProcessed());
            assertTrue(record.getReviewReason().startsWith(PaymentLedger.REVIEW_DUPLICATE_ENTRY));
            assertEquals(1, groupService.getGroup(group.getId()).getCurrentMemberCount());

            printSuccess("Duplicate entry kept for refund review");
        }

        @Test
        @DisplayName("3.2 Second payment for a paid contribution is flagged for refund")
        void testDuplicateContributionPayment_Flagged() {
            printTestHeader("3.2 Duplicate Contribution Payment");

            gatewayPaysInFull();
            GroupEntity group = createGroup(2, 500, Frequency.DAILY, "2.00");
            List<UUID> members = fillGroup(group);
            cycleScheduler.advanceIfComplete(group.getId(), 1);
            ContributionEntity contribution = contributionRepository
                .findByGroupIdAndUserIdOrderByCycleNumberAsc(group.getId(), members.get(0)).get(1);

            PaymentRecord first = initiateContribution(group.getId(), members.get(0), contribution.getId());
            PaymentRecord second = initiateContribution(group.getId(), members.get(0), contribution.getId());

            assertEquals(SettlementResult.Status.CONTRIBUTION_PAID,
                settlementService.verifyAndSettle(first.getReference()).getStatus());
            assertEquals(SettlementResult.Status.FLAGGED_FOR_REVIEW,
                settlementService.verifyAndSettle(second.getReference()).getStatus());

            assertTrue(paymentLedger.getByReference(second.getReference()).getReviewReason()
                .startsWith(PaymentLedger.REVIEW_DUPLICATE_PAYMENT));
            ContributionEntity paid = contributionRepository.findById(contribution.getId()).orElseThrow();
            assertEquals(ContributionStatus.PAID, paid.getStatus());
            assertEquals(first.getReference(), paid.getPaymentReference());

            printSuccess("Contribution paid once, second charge flagged");
        }
    }

    @Nested
    @DisplayName("4. Reconciliation Scenarios")
    class Reconciliation {

        @Test
        @DisplayName("4.1 Stale pending payment is verified and applied by the scan")
        void testReconcile_StalePendingPayment() {
            printTestHeader("4.1 Reconcile Stale Payment");

            gatewayPaysInFull();
            clock.set(Instant.parse("2020-06-01T00:00:00Z"));
            GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
            UUID staleUser = UUID.randomUUID();
            PaymentRecord stale = initiateEntry(group.getId(), staleUser, null);

            clock.advance(Duration.ofMinutes(8));
            PaymentRecord recent = initiateEntry(group.getId(), UUID.randomUUID(), null);

            clock.advance(Duration.ofMinutes(3));
            ScanReport report = scanService.run(null, EnumSet.of(ScanTask.RECONCILE));
            printOutput("Report", report);

            assertTrue(paymentLedger.getByReference(stale.getReference()).isProcessed());
            assertTrue(membershipRepository.findByGroupIdAndUserId(group.getId(), staleUser).isPresent());
            assertTrue(paymentLedger.getByReference(recent.getReference()).isPending(),
                "Payment younger than the reconcile delay should be left alone");
            verify(gatewayClient, times(0)).verify(recent.getReference());

            printSuccess("Only the stale payment was reconciled");
        }
    }
}
