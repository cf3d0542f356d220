package com.flagship.savings_circle.gateway;

import com.flagship.savings_circle.payment.GatewayStatus;
import lombok.Value;

/**
 * What the gateway says about one reference. Amount is in the currency's minor unit.
 */
@Value
public class GatewayVerification {
    String reference;
    GatewayStatus status;
    long amount;
    String currency;
    String gatewayResponse;

    public boolean isFinal() {
        return status != GatewayStatus.IN_PROGRESS;
    }
}
