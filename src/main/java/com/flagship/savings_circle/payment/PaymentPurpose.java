package com.flagship.savings_circle.payment;

import java.util.UUID;

/**
 * What a payment is for. Resolved once when the record is read from the ledger,
 * so settlement code dispatches on the variant instead of inspecting loose metadata.
 */
public sealed interface PaymentPurpose permits EntryPayment, RecurringContribution {

    UUID groupId();

    UUID userId();

    PurposeType type();
}
