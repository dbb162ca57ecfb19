package com.flagship.mobile_payments.gateway;

/**
 * The gateway refused the request (4xx) or answered with a body that cannot
 * be interpreted. Permanent: retrying the same request will not help.
 */
public class GatewayRejectedException extends RuntimeException {

    public GatewayRejectedException(String message) {
        super(message);
    }

    public GatewayRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
