package com.flagship.mobile_payments.gateway;

/**
 * Port to the remote mobile-money gateway.
 */
public interface MobileMoneyGateway {

    /**
     * Sends a push prompt to the payer's phone.
     *
     * @throws GatewayUnavailableException on timeouts, connection failures and 5xx answers
     * @throws GatewayRejectedException on 4xx answers and malformed acknowledgements
     */
    GatewayAcknowledgement initiatePush(PushRequest request);

    /**
     * Asks the gateway for the current outcome of an accepted push.
     *
     * @throws GatewayUnavailableException on timeouts, connection failures and 5xx answers
     * @throws GatewayRejectedException on 4xx answers and unrecognised bodies
     */
    GatewayStatus queryStatus(String remoteCheckoutId);
}
