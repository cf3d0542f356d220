package com.flagship.savings_circle.gateway;

/**
 * Transport failure or 5xx talking to the gateway. Safe to retry.
 */
public class GatewayUnreachableException extends GatewayException {

    public GatewayUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
