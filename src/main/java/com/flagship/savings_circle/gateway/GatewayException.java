package com.flagship.savings_circle.gateway;

/**
 * The payment gateway could not give a usable answer.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
