package com.flagship.savings_circle.consumer;

import com.flagship.savings_circle.event.ContributionPaidEvent;
import com.flagship.savings_circle.event.CycleCompletedEvent;
import com.flagship.savings_circle.event.MembershipActivatedEvent;
import com.flagship.savings_circle.event.PayoutCreditedEvent;
import com.flagship.savings_circle.event.PenaltyAppliedEvent;
import com.flagship.savings_circle.membership.MembershipEntity;
import com.flagship.savings_circle.membership.MembershipRepository;
import com.flagship.savings_circle.membership.MembershipStatus;
import com.flagship.savings_circle.notification.NotificationStore;
import com.flagship.savings_circle.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Turns group events into in-app notifications.
 *
 * Runs inside {@link IdempotentEventProcessor}, and the store ignores a
 * repeated (event, user) pair, so replays never double-notify.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationEventHandler {

    private final NotificationStore notificationStore;
    private final MembershipRepository membershipRepository;

    public void onMembershipActivated(MembershipActivatedEvent event) {
        notificationStore.save(event.getUserId(), NotificationType.MEMBERSHIP_ACTIVATED,
            "Welcome to the group",
            String.format("Your entry payment was confirmed. You hold slot %d.", event.getSlotNumber()),
            event.getGroupId(), event.getEventId());

        if (event.isGroupActivated()) {
            int notified = notifyActiveMembers(event.getGroupId(), event.getEventId(), NotificationType.GROUP_STARTED,
                "Your group has started",
                "Every slot is filled and the first contribution cycle is open.");
            log.info("Group {} started, {} members notified", event.getGroupId(), notified);
        }
    }

    public void onContributionPaid(ContributionPaidEvent event) {
        String message = event.getPenaltyAmount() > 0
            ? String.format("We received %d for cycle %d, including a late penalty of %d.",
                event.getAmount() + event.getPenaltyAmount(), event.getCycleNumber(), event.getPenaltyAmount())
            : String.format("We received %d for cycle %d.", event.getAmount(), event.getCycleNumber());
        notificationStore.save(event.getUserId(), NotificationType.CONTRIBUTION_RECEIVED,
            "Contribution received", message, event.getGroupId(), event.getEventId());
    }

    public void onCycleCompleted(CycleCompletedEvent event) {
        String message = event.isGroupCompleted()
            ? String.format("Cycle %d was the last one. The rotation is complete.", event.getCycleNumber())
            : String.format("Cycle %d is complete. Cycle %d is now open.", event.getCycleNumber(), event.getNextCycle());
        notifyActiveMembers(event.getGroupId(), event.getEventId(), NotificationType.CYCLE_COMPLETED,
            "Cycle completed", message);
    }

    public void onPayoutCredited(PayoutCreditedEvent event) {
        if (event.getRecipientUserId() == null) {
            log.warn("Payout for cycle {} of group {} is unclaimed, nobody to notify",
                event.getCycleNumber(), event.getGroupId());
            return;
        }
        notificationStore.save(event.getRecipientUserId(), NotificationType.PAYOUT_CREDITED,
            "Payout credited",
            String.format("%d was credited to your wallet for cycle %d (service fee %d).",
                event.getAmount(), event.getCycleNumber(), event.getServiceFee()),
            event.getGroupId(), event.getEventId());
    }

    public void onPenaltyApplied(PenaltyAppliedEvent event) {
        notificationStore.save(event.getUserId(), NotificationType.PENALTY_APPLIED,
            "Late payment penalty",
            String.format("Your cycle %d contribution is %d days overdue. A penalty of %d was added.",
                event.getCycleNumber(), event.getDaysOverdue(), event.getAmount()),
            event.getGroupId(), event.getEventId());
    }

    private int notifyActiveMembers(UUID groupId, UUID eventId, NotificationType type, String title, String message) {
        int notified = 0;
        for (MembershipEntity member
                : membershipRepository.findByGroupIdAndStatusOrderBySlotNumberAsc(groupId, MembershipStatus.ACTIVE)) {
            if (notificationStore.save(member.getUserId(), type, title, message, groupId, eventId)) {
                notified++;
            }
        }
        return notified;
    }
}
