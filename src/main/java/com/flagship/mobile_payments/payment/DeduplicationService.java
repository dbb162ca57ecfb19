package com.flagship.mobile_payments.payment;

import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Redis fast path for duplicate payment intents.
 *
 * Redis maps a dedup key to the checkout id of the latest transaction for it,
 * with a TTL equal to the dedup window. A hit is confirmed against the store
 * before it is trusted; a miss, or Redis being down, falls through to the
 * authoritative check inside {@link TransactionStore#insertIfAbsent}.
 */
@Service
@Slf4j
public class DeduplicationService {

    private static final String REDIS_KEY_PREFIX = "dedup:";

    private final TransactionStore store;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final PaymentMetrics metrics;
    private final Duration window;

    public DeduplicationService(TransactionStore store,
                                Optional<StringRedisTemplate> redisTemplate,
                                PaymentMetrics metrics,
                                @Value("${payments.dedup-window:2m}") Duration window) {
        this.store = store;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
        this.window = window;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Checkout id of a live transaction for this key created at or after windowStart.
     */
    public Optional<String> findLiveDuplicate(String dedupKey, Instant windowStart) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }

        String checkoutId;
        try {
            checkoutId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + dedupKey);
        } catch (Exception e) {
            log.warn("Redis lookup failed for dedup key {}. Falling back to database. Error: {}",
                    dedupKey, e.getMessage());
            return Optional.empty();
        }

        if (checkoutId == null) {
            metrics.recordDedupCache(false);
            return Optional.empty();
        }

        Optional<String> live = store.findByCheckoutId(checkoutId)
                .filter(existing -> !existing.isTerminal())
                .filter(existing -> !existing.getCreatedAt().isBefore(windowStart))
                .map(PaymentTransaction::getCheckoutId);
        metrics.recordDedupCache(live.isPresent());
        return live;
    }

    /**
     * Best effort: the database stays the source of truth.
     */
    public void remember(String dedupKey, String checkoutId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + dedupKey, checkoutId, window);
            log.debug("Stored dedup key in Redis: {} -> {}", dedupKey, checkoutId);
        } catch (Exception e) {
            log.warn("Failed to store dedup key in Redis: {}. Error: {}", dedupKey, e.getMessage());
        }
    }
}
