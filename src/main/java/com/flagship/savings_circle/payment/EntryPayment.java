package com.flagship.savings_circle.payment;

import java.util.Objects;
import java.util.UUID;

/**
 * Security deposit plus first contribution; turns a slot reservation into a membership.
 *
 * @param preferredSlot slot the payer reserved, or null for any slot
 */
public record EntryPayment(UUID groupId, UUID userId, Integer preferredSlot) implements PaymentPurpose {

    public EntryPayment {
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(userId, "userId");
    }

    @Override
    public PurposeType type() {
        return PurposeType.ENTRY_PAYMENT;
    }
}
