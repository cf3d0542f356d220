package com.flagship.savings_circle.webhook;

import lombok.Value;

/**
 * The two fields of a gateway webhook this service reads.
 */
@Value
public class GatewayWebhookEvent {
    String event;
    String reference;
}
