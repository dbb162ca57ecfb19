package com.flagship.mobile_payments.payment.event;

import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published on every status change of a payment transaction, including the
 * initial QUEUED insert (previousStatus is null then).
 *
 * Consumers deduplicate on eventId; the Kafka key is the checkout id so all
 * events of one transaction land on the same partition in order.
 */
@Value
public class PaymentStatusChangedEvent {
    UUID eventId;
    String checkoutId;
    String ownerReference;
    BigDecimal amount;
    String planReference;
    String previousStatus;
    String status;
    String reference;
    String errorDetail;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentStatusChanged";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentStatusChangedEvent of(PaymentTransaction transaction, TransactionStatus previousStatus) {
        return new PaymentStatusChangedEvent(
            UUID.randomUUID(),
            transaction.getCheckoutId(),
            transaction.getOwnerReference(),
            transaction.getAmount(),
            transaction.getPlanReference(),
            previousStatus != null ? previousStatus.wireName() : null,
            transaction.getStatus().wireName(),
            transaction.getReference(),
            transaction.getErrorDetail(),
            transaction.getUpdatedAt()
        );
    }
}
