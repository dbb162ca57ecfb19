package com.flagship.mobile_payments.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mobile_payments.gateway.GatewayOutcome;
import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.payment.exception.UnknownTransactionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives payment outcomes pushed by the gateway.
 *
 * Always answers 200: the gateway retries anything else, and a callback we
 * cannot use now (unknown id, malformed body) will not become usable by
 * resending it. Such callbacks are logged and counted; the poller reconciles
 * the record.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class GatewayCallbackController {

    private final StatusReconciler reconciler;
    private final ObjectMapper objectMapper;
    private final PaymentMetrics metrics;

    @PostMapping("/callback")
    public ResponseEntity<Map<String, String>> callback(@RequestBody(required = false) String body) {
        GatewayCallbackRequest request;
        try {
            request = objectMapper.readValue(body == null ? "" : body, GatewayCallbackRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Discarding malformed gateway callback: {}", e.getMessage());
            metrics.recordCallback("malformed");
            return acknowledged();
        }

        if (request.getRemoteCheckoutId() == null || request.getRemoteCheckoutId().isBlank()) {
            log.warn("Discarding gateway callback without checkout id");
            metrics.recordCallback("malformed");
            return acknowledged();
        }

        // A callback naming a known transaction but no recognisable outcome is a malformed response.
        GatewayOutcome outcome = request.resolveOutcome().orElse(GatewayOutcome.ERROR);
        String message = request.resolveOutcome().isPresent()
                ? request.getMessage()
                : "malformed gateway callback: unrecognised outcome '" + request.getOutcome() + "'";

        try {
            TransitionResult result = reconciler.applyOutcome(
                    request.getRemoteCheckoutId(), outcome, request.getReference(), message);
            metrics.recordCallback(result == TransitionResult.NO_OP ? "ignored" : "applied");
        } catch (UnknownTransactionException e) {
            log.warn("Gateway callback for unknown transaction: {}", e.getMessage());
            metrics.recordCallback("unknown");
        } catch (RuntimeException e) {
            log.error("Failed to apply gateway callback for {}", request.getRemoteCheckoutId(), e);
            metrics.recordCallback("error");
        }

        return acknowledged();
    }

    private static ResponseEntity<Map<String, String>> acknowledged() {
        return ResponseEntity.ok(Map.of("status", "received"));
    }
}
