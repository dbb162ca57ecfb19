package com.flagship.mobile_payments.gateway;

/**
 * The gateway could not be reached or answered with a server error.
 * Transient: the caller may retry.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
