package com.flagship.savings_circle.payment;

import java.util.Objects;
import java.util.UUID;

/**
 * Settles one existing contribution of an active member.
 */
public record RecurringContribution(UUID groupId, UUID userId, UUID contributionId, int cycleNumber)
        implements PaymentPurpose {

    public RecurringContribution {
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(contributionId, "contributionId");
    }

    @Override
    public PurposeType type() {
        return PurposeType.RECURRING_CONTRIBUTION;
    }
}
