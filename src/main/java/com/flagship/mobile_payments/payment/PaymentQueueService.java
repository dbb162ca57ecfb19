package com.flagship.mobile_payments.payment;

import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.payment.exception.DuplicateRequestException;
import com.flagship.mobile_payments.payment.exception.InvalidRequestException;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Accepts payment intents into the queue.
 *
 * Enqueue validates, deduplicates and persists the intent as QUEUED, then
 * returns. It never talks to the gateway; {@code DispatchWorker} picks the
 * record up from the store.
 */
@Service
@Slf4j
public class PaymentQueueService {

    static final String CHECKOUT_ID_PREFIX = "LIP";
    private static final int MAX_AMOUNT_SCALE = 4;

    private final TransactionStore store;
    private final DeduplicationService deduplicationService;
    private final PlanCatalog planCatalog;
    private final PhoneNumberFormatter phoneNumberFormatter;
    private final PaymentMetrics metrics;
    private final Clock clock;

    public PaymentQueueService(TransactionStore store,
                               DeduplicationService deduplicationService,
                               PlanCatalog planCatalog,
                               PhoneNumberFormatter phoneNumberFormatter,
                               PaymentMetrics metrics,
                               Clock clock) {
        this.store = store;
        this.deduplicationService = deduplicationService;
        this.planCatalog = planCatalog;
        this.phoneNumberFormatter = phoneNumberFormatter;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Queues a payment intent.
     *
     * @param phoneNumber optional payer phone number; normalised before storing
     * @return the stored QUEUED transaction
     * @throws InvalidRequestException if the intent fails validation
     * @throws DuplicateRequestException if a live transaction for the same
     *         owner, amount and plan was created inside the dedup window
     */
    public PaymentTransaction enqueue(String ownerReference, BigDecimal amount, String planReference,
                                      String phoneNumber) {
        String msisdn;
        try {
            validate(ownerReference, amount, planReference);
            msisdn = phoneNumber == null || phoneNumber.isBlank() ? null : phoneNumberFormatter.format(phoneNumber);
        } catch (InvalidRequestException e) {
            metrics.incrementInvalidRequests();
            throw e;
        }

        String owner = ownerReference.trim();
        String plan = planReference.trim();
        String dedupKey = PaymentTransaction.dedupKeyOf(owner, amount, plan);
        Instant windowStart = clock.instant().minus(deduplicationService.getWindow());

        deduplicationService.findLiveDuplicate(dedupKey, windowStart).ifPresent(existing -> {
            metrics.incrementDuplicateRequests();
            log.info("Duplicate payment intent for owner={} plan={}: existing checkoutId={}", owner, plan, existing);
            throw new DuplicateRequestException(existing);
        });

        PaymentTransaction candidate = PaymentTransaction.create(newCheckoutId(), owner, amount, plan, msisdn, clock.instant());
        PaymentTransaction stored = store.insertIfAbsent(candidate, windowStart);

        deduplicationService.remember(dedupKey, stored.getCheckoutId());

        if (!stored.getCheckoutId().equals(candidate.getCheckoutId())) {
            metrics.incrementDuplicateRequests();
            log.info("Duplicate payment intent for owner={} plan={}: existing checkoutId={}",
                    owner, plan, stored.getCheckoutId());
            throw new DuplicateRequestException(stored.getCheckoutId());
        }

        metrics.incrementEnqueued();
        log.info("Queued payment checkoutId={} owner={} plan={} amount={}",
                stored.getCheckoutId(), owner, plan, amount.toPlainString());
        return stored;
    }

    private void validate(String ownerReference, BigDecimal amount, String planReference) {
        if (ownerReference == null || ownerReference.isBlank()) {
            throw new InvalidRequestException("Owner reference is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidRequestException("Amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new InvalidRequestException("Amount supports at most " + MAX_AMOUNT_SCALE + " decimal places");
        }
        if (!planCatalog.isRecognised(planReference)) {
            throw new InvalidRequestException(
                    "Unknown plan '" + planReference + "'; expected one of: " + planCatalog.describe());
        }
    }

    static String newCheckoutId() {
        return CHECKOUT_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
    }
}
