package com.flagship.mobile_payments.transaction;

import com.flagship.mobile_payments.outbox.OutboxService;
import com.flagship.mobile_payments.payment.event.PaymentStatusChangedEvent;
import com.flagship.mobile_payments.payment.exception.TransactionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * PostgreSQL-backed transaction store.
 *
 * Each operation runs in its own database transaction. Compare-and-set relies
 * on the entity's @Version column: a concurrent writer makes the flush fail,
 * and the attempt is repeated against the freshly committed state.
 *
 * Every status change writes a PaymentStatusChanged event to the outbox in
 * the same transaction.
 */
@Service
@Slf4j
public class JpaTransactionStore implements TransactionStore {

    public static final String AGGREGATE_TYPE = "PaymentTransaction";
    private static final int MAX_CAS_ATTEMPTS = 5;

    private final PaymentTransactionRepository repository;
    private final OutboxService outboxService;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaTransactionStore(PaymentTransactionRepository repository,
                               OutboxService outboxService,
                               JdbcTemplate jdbcTemplate,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.repository = repository;
        this.outboxService = outboxService;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public PaymentTransaction insertIfAbsent(PaymentTransaction candidate, Instant windowStart) {
        return transactionTemplate.execute(status -> {
            String dedupKey = candidate.dedupKey();
            // Serialises concurrent submissions of the same intent until commit.
            lockDedupKey(dedupKey);

            List<PaymentTransactionEntity> duplicates =
                    repository.findLiveDuplicates(dedupKey, TransactionStatus.live(), windowStart);
            if (!duplicates.isEmpty()) {
                PaymentTransaction existing = duplicates.get(0).toDomain();
                log.debug("Live duplicate {} found for dedup key {}", existing.getCheckoutId(), dedupKey);
                return existing;
            }

            PaymentTransactionEntity saved = repository.save(PaymentTransactionEntity.fromDomain(candidate));
            PaymentTransaction inserted = saved.toDomain();
            recordStatusChange(inserted, null);

            log.debug("Inserted transaction {} in {} status", inserted.getCheckoutId(), inserted.getStatus());
            return inserted;
        });
    }

    @Override
    public Optional<PaymentTransaction> findByCheckoutId(String checkoutId) {
        return repository.findById(checkoutId).map(PaymentTransactionEntity::toDomain);
    }

    @Override
    public Optional<PaymentTransaction> findByRemoteCheckoutId(String remoteCheckoutId) {
        return repository.findByRemoteCheckoutId(remoteCheckoutId).map(PaymentTransactionEntity::toDomain);
    }

    @Override
    public List<PaymentTransaction> findByOwner(String ownerReference, TransactionStatus status, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<PaymentTransactionEntity> rows = status == null
                ? repository.findByOwnerReferenceOrderByCreatedAtDesc(ownerReference, page)
                : repository.findByOwnerReferenceAndStatusOrderByCreatedAtDesc(ownerReference, status, page);
        return rows.stream().map(PaymentTransactionEntity::toDomain).toList();
    }

    @Override
    public Optional<PaymentTransaction> compareAndSet(String checkoutId,
                                                      Predicate<PaymentTransaction> expected,
                                                      UnaryOperator<PaymentTransaction> update) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> applyOnce(checkoutId, expected, update));
            } catch (ObjectOptimisticLockingFailureException e) {
                if (attempt >= MAX_CAS_ATTEMPTS) {
                    log.warn("Giving up on transaction {} after {} conflicting writes", checkoutId, attempt);
                    throw e;
                }
                log.debug("Concurrent write on transaction {}, re-reading (attempt {})", checkoutId, attempt);
            }
        }
    }

    private Optional<PaymentTransaction> applyOnce(String checkoutId,
                                                   Predicate<PaymentTransaction> expected,
                                                   UnaryOperator<PaymentTransaction> update) {
        PaymentTransactionEntity entity = repository.findById(checkoutId)
                .orElseThrow(() -> new TransactionNotFoundException(checkoutId));

        PaymentTransaction current = entity.toDomain();
        if (!expected.test(current)) {
            return Optional.empty();
        }

        PaymentTransaction next = update.apply(current);
        entity.updateFromDomain(next);
        PaymentTransactionEntity saved = repository.saveAndFlush(entity);
        PaymentTransaction stored = saved.toDomain();

        if (stored.getStatus() != current.getStatus()) {
            recordStatusChange(stored, current.getStatus());
        }
        return Optional.of(stored);
    }

    @Override
    public List<PaymentTransaction> claimQueued(int limit, Instant reclaimBefore) {
        return transactionTemplate.execute(status -> {
            List<PaymentTransactionEntity> rows = repository.findQueuedForDispatch(reclaimBefore, limit);
            Instant now = clock.instant();
            rows.forEach(row -> row.claimForDispatch(now));
            repository.saveAll(rows);
            return rows.stream().map(PaymentTransactionEntity::toDomain).toList();
        });
    }

    @Override
    public List<PaymentTransaction> findAwaitingGateway(Instant updatedBefore, int limit) {
        return repository.findAwaitingGateway(updatedBefore, limit).stream()
                .map(PaymentTransactionEntity::toDomain)
                .toList();
    }

    @Override
    public List<PaymentTransaction> findStale(Instant createdBefore, int limit) {
        return repository.findStale(createdBefore, limit).stream()
                .map(PaymentTransactionEntity::toDomain)
                .toList();
    }

    @Override
    public List<PaymentTransaction> findIncompleteCredits(Instant attemptedBefore, int limit) {
        return repository.findIncompleteCredits(attemptedBefore, limit).stream()
                .map(PaymentTransactionEntity::toDomain)
                .toList();
    }

    @Override
    public long countByStatus(TransactionStatus status) {
        return repository.countByStatus(status);
    }

    private void lockDedupKey(String dedupKey) {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext(?))", rs -> null, dedupKey);
    }

    private void recordStatusChange(PaymentTransaction transaction, TransactionStatus previousStatus) {
        PaymentStatusChangedEvent event = PaymentStatusChangedEvent.of(transaction, previousStatus);
        outboxService.saveEvent(AGGREGATE_TYPE, transaction.getCheckoutId(), event.getEventType(), event);
    }
}
