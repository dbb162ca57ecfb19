package com.flagship.mobile_payments.gateway;

import com.flagship.mobile_payments.transaction.TransactionStatus;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome of a payment as reported by the gateway, through a callback, a
 * status poll or the push acknowledgement itself.
 */
public enum GatewayOutcome {
    PENDING(TransactionStatus.PENDING),
    COMPLETED(TransactionStatus.COMPLETED),
    FAILED(TransactionStatus.FAILED),
    CANCELLED(TransactionStatus.CANCELLED),
    ERROR(TransactionStatus.ERROR);

    private final TransactionStatus targetStatus;

    GatewayOutcome(TransactionStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public TransactionStatus targetStatus() {
        return targetStatus;
    }

    /**
     * Maps the provider's status vocabulary. Empty for anything unrecognised.
     */
    public static Optional<GatewayOutcome> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "success", "successful", "completed", "complete", "paid" -> Optional.of(COMPLETED);
            case "pending", "processing", "queued" -> Optional.of(PENDING);
            case "failed", "failure", "declined" -> Optional.of(FAILED);
            case "cancelled", "canceled" -> Optional.of(CANCELLED);
            case "error" -> Optional.of(ERROR);
            default -> Optional.empty();
        };
    }
}
