package com.flagship.mobile_payments.gateway;

import lombok.Value;

/**
 * Answer of the gateway's status endpoint for one remote checkout id.
 */
@Value
public class GatewayStatus {
    GatewayOutcome outcome;
    String reference;
    String message;
}
