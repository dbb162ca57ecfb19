package com.flagship.mobile_payments.gateway;

import lombok.Value;

/**
 * Synchronous answer to a push request.
 *
 * PENDING: the prompt was sent and the gateway assigned remoteCheckoutId.
 * COMPLETED: the gateway already confirmed the payment.
 * FAILED: the gateway answered but declined to send the prompt; message says why.
 */
@Value
public class GatewayAcknowledgement {
    String remoteCheckoutId;
    GatewayOutcome outcome;
    String reference;
    String message;

    public static GatewayAcknowledgement accepted(String remoteCheckoutId, String message) {
        return new GatewayAcknowledgement(remoteCheckoutId, GatewayOutcome.PENDING, null, message);
    }

    public static GatewayAcknowledgement completed(String remoteCheckoutId, String reference, String message) {
        return new GatewayAcknowledgement(remoteCheckoutId, GatewayOutcome.COMPLETED, reference, message);
    }

    public static GatewayAcknowledgement failed(String message) {
        return new GatewayAcknowledgement(null, GatewayOutcome.FAILED, null, message);
    }
}
