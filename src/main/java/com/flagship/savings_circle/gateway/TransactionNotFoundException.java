package com.flagship.savings_circle.gateway;

/**
 * The gateway has no transaction for the reference. Retried a few times since
 * a charge can take a moment to show up after checkout.
 */
public class TransactionNotFoundException extends GatewayException {

    private final String reference;

    public TransactionNotFoundException(String reference) {
        super("Gateway has no transaction for reference " + reference);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
