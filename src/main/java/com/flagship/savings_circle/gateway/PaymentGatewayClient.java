package com.flagship.savings_circle.gateway;

/**
 * Server-side lookup of a charge by reference. The only trusted source of
 * "was this paid, and how much".
 */
public interface PaymentGatewayClient {

    /**
     * @throws GatewayUnreachableException on transport failure or a gateway-side error
     * @throws TransactionNotFoundException if the gateway does not know the reference
     * @throws GatewayException if the gateway rejects the request
     */
    GatewayVerification verify(String reference);
}
