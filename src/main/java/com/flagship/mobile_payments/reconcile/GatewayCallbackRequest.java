package com.flagship.mobile_payments.reconcile;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mobile_payments.gateway.GatewayOutcome;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Optional;

/**
 * Callback body. Accepts both the documented field names and the provider's
 * own spellings (CheckoutRequestID, refference, success, status, reason).
 */
@Getter
@Setter
@NoArgsConstructor
public class GatewayCallbackRequest {

    @JsonProperty("remote_checkout_id")
    @JsonAlias({"CheckoutRequestID", "checkout_request_id", "checkoutRequestId"})
    private String remoteCheckoutId;

    @JsonProperty("outcome")
    @JsonAlias({"status", "ResultStatus"})
    private String outcome;

    @JsonProperty("success")
    private Boolean success;

    @JsonProperty("reference")
    @JsonAlias({"refference", "MpesaReceiptNumber"})
    private String reference;

    @JsonProperty("message")
    @JsonAlias({"reason", "ResultDesc"})
    private String message;

    /**
     * An explicit outcome wins over the success flag.
     */
    public Optional<GatewayOutcome> resolveOutcome() {
        Optional<GatewayOutcome> named = GatewayOutcome.fromWire(outcome);
        if (named.isPresent()) {
            return named;
        }
        if (success != null) {
            return Optional.of(success ? GatewayOutcome.COMPLETED : GatewayOutcome.FAILED);
        }
        return Optional.empty();
    }
}
