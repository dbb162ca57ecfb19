package com.flagship.mobile_payments.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mobile_payments.credit.BalanceCreditHook;
import com.flagship.mobile_payments.gateway.MobileMoneyGateway;
import com.flagship.mobile_payments.outbox.OutboxEvent;
import com.flagship.mobile_payments.outbox.OutboxEventRepository;
import com.flagship.mobile_payments.outbox.OutboxService;
import com.flagship.mobile_payments.payment.event.PaymentStatusChangedEvent;
import com.flagship.mobile_payments.payment.exception.TransactionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PostgreSQL transaction store tests.
 *
 * These tests verify that:
 * - Deduplication holds under concurrent inserts of the same intent
 * - Compare-and-set lets exactly one concurrent writer win
 * - A queued record is claimed by one dispatcher at a time
 * - Every status change is written to the outbox in order
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JpaTransactionStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("mobile_payments_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Background loops and Kafka stay off; tests drive the store directly
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("scheduling.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @MockBean
    private MobileMoneyGateway gateway;

    @MockBean
    private BalanceCreditHook creditHook;

    @Autowired
    private TransactionStore store;

    @Autowired
    private PaymentTransactionRepository repository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ObjectMapper objectMapper;

    private String owner;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        repository.deleteAll();
        owner = "user-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private PaymentTransaction candidate(String checkoutId) {
        return PaymentTransaction.create(checkoutId, owner, new BigDecimal("20"), "basic", "0712345678", Instant.now());
    }

    private static Instant windowStart() {
        return Instant.now().minusSeconds(120);
    }

    @Nested
    @DisplayName("Insert and deduplication")
    class InsertTests {

        @Test
        @DisplayName("Live duplicate inside the window is returned instead of inserting")
        void testDuplicateReturnsExisting() {
            printTestHeader("Duplicate insert");

            PaymentTransaction first = store.insertIfAbsent(candidate("LIP1"), windowStart());
            PaymentTransaction second = store.insertIfAbsent(candidate("LIP2"), windowStart());
            printOutput("Second insert returned", second.getCheckoutId());

            assertEquals("LIP1", first.getCheckoutId());
            assertEquals("LIP1", second.getCheckoutId());
            assertEquals(1, repository.count());
            printSuccess("Only the first intent was stored");
        }

        @Test
        @DisplayName("Terminal duplicate does not block a new insert")
        void testTerminalDuplicateIgnored() {
            store.insertIfAbsent(candidate("LIP1"), windowStart());
            store.compareAndSet("LIP1", t -> true, t -> t.transitionTo(TransactionStatus.FAILED, "declined", Instant.now()));

            PaymentTransaction second = store.insertIfAbsent(candidate("LIP2"), windowStart());

            assertEquals("LIP2", second.getCheckoutId());
            assertEquals(2, repository.count());
        }

        @Test
        @DisplayName("Concurrent inserts of the same intent store one row")
        void testConcurrentInserts() throws Exception {
            printTestHeader("Concurrent inserts");

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<PaymentTransaction>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String checkoutId = "LIPC" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    return store.insertIfAbsent(candidate(checkoutId), windowStart());
                }));
            }
            start.countDown();

            Set<String> returned = new HashSet<>();
            for (Future<PaymentTransaction> result : results) {
                returned.add(result.get(30, TimeUnit.SECONDS).getCheckoutId());
            }
            executor.shutdown();
            printOutput("Distinct checkout ids returned", returned);

            assertEquals(1, returned.size());
            assertEquals(1, repository.count());
            printSuccess("Advisory lock serialised the inserts");
        }

        @Test
        @DisplayName("Stored record round-trips every field")
        void testRoundTrip() {
            store.insertIfAbsent(candidate("LIP1"), windowStart());

            PaymentTransaction loaded = store.findByCheckoutId("LIP1").orElseThrow();

            assertEquals(owner, loaded.getOwnerReference());
            assertEquals(0, new BigDecimal("20").compareTo(loaded.getAmount()));
            assertEquals("basic", loaded.getPlanReference());
            assertEquals("0712345678", loaded.getMsisdn());
            assertEquals(TransactionStatus.QUEUED, loaded.getStatus());
            assertEquals(CreditState.NONE, loaded.getCreditState());
        }
    }

    @Nested
    @DisplayName("Compare-and-set")
    class CompareAndSetTests {

        @Test
        @DisplayName("Update is skipped when the predicate no longer holds")
        void testPredicateFails() {
            store.insertIfAbsent(candidate("LIP1"), windowStart());

            assertTrue(store.compareAndSet("LIP1",
                    t -> t.getStatus() == TransactionStatus.PROCESSING,
                    t -> t.transitionTo(TransactionStatus.COMPLETED, null, Instant.now())).isEmpty());
            assertEquals(TransactionStatus.QUEUED, store.findByCheckoutId("LIP1").orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Unknown checkout id is reported")
        void testUnknownId() {
            assertThrows(TransactionNotFoundException.class,
                    () -> store.compareAndSet("nope", t -> true, t -> t));
        }

        @Test
        @DisplayName("Concurrent writers: exactly one wins")
        void testConcurrentWriters() throws Exception {
            printTestHeader("Concurrent compare-and-set");
            store.insertIfAbsent(candidate("LIP1"), windowStart());

            int threads = 6;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String remoteId = "ws_" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    return store.compareAndSet("LIP1",
                            t -> t.getStatus() == TransactionStatus.QUEUED,
                            t -> t.acceptedByGateway(remoteId, Instant.now())).isPresent();
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            executor.shutdown();
            printOutput("Winners", winners);

            assertEquals(1, winners);
            assertEquals(TransactionStatus.PROCESSING, store.findByCheckoutId("LIP1").orElseThrow().getStatus());
            printSuccess("One writer won, the rest saw a stale predicate");
        }

        @Test
        @DisplayName("Remote checkout id lookup finds the accepted record")
        void testFindByRemoteId() {
            store.insertIfAbsent(candidate("LIP1"), windowStart());
            store.compareAndSet("LIP1", t -> true, t -> t.acceptedByGateway("ws_CO_1", Instant.now()));

            assertEquals("LIP1", store.findByRemoteCheckoutId("ws_CO_1").orElseThrow().getCheckoutId());
            assertTrue(store.findByRemoteCheckoutId("ws_CO_2").isEmpty());
        }
    }

    @Nested
    @DisplayName("Background queries")
    class QueryTests {

        @Test
        @DisplayName("A claimed record is not handed out again until the claim expires")
        void testClaimQueued() {
            printTestHeader("Claim queued");
            store.insertIfAbsent(candidate("LIP1"), windowStart());
            store.insertIfAbsent(PaymentTransaction.create("LIP2", owner, new BigDecimal("50"), "basic", null, Instant.now()),
                    windowStart());

            List<PaymentTransaction> first = store.claimQueued(10, Instant.now().minusSeconds(120));
            List<PaymentTransaction> second = store.claimQueued(10, Instant.now().minusSeconds(120));
            List<PaymentTransaction> reclaimed = store.claimQueued(10, Instant.now().plusSeconds(1));
            printOutput("Claims", first.size() + ", " + second.size() + ", " + reclaimed.size());

            assertEquals(List.of("LIP1", "LIP2"), first.stream().map(PaymentTransaction::getCheckoutId).toList());
            assertTrue(second.isEmpty());
            assertEquals(2, reclaimed.size());
            printSuccess("Claims are exclusive until they expire");
        }

        @Test
        @DisplayName("Stale, awaiting and incomplete-credit queries select the right records")
        void testBackgroundQueries() {
            store.insertIfAbsent(candidate("LIP1"), windowStart());
            store.insertIfAbsent(PaymentTransaction.create("LIP2", owner, new BigDecimal("50"), "basic", null, Instant.now()),
                    windowStart());
            store.insertIfAbsent(PaymentTransaction.create("LIP3", owner, new BigDecimal("70"), "basic", null, Instant.now()),
                    windowStart());
            store.compareAndSet("LIP2", t -> true, t -> t.acceptedByGateway("ws_2", Instant.now()));
            store.compareAndSet("LIP3", t -> true, t -> t.acceptedByGateway("ws_3", Instant.now()).beginCredit("R3", Instant.now()).creditFailed("down", Instant.now()));

            Instant future = Instant.now().plusSeconds(60);

            assertEquals(List.of("LIP2"),
                    store.findAwaitingGateway(future, 10).stream().map(PaymentTransaction::getCheckoutId).toList());
            assertEquals(Set.of("LIP1", "LIP2"),
                    new HashSet<>(store.findStale(future, 10).stream().map(PaymentTransaction::getCheckoutId).toList()));
            assertEquals(List.of("LIP3"),
                    store.findIncompleteCredits(Instant.now().minusSeconds(60), 10).stream()
                            .map(PaymentTransaction::getCheckoutId).toList());
            assertTrue(store.findStale(Instant.now().minusSeconds(60), 10).isEmpty());
            assertEquals(1, store.countByStatus(TransactionStatus.QUEUED));
            assertEquals(2, store.countByStatus(TransactionStatus.PROCESSING));
        }

        @Test
        @DisplayName("Owner history is newest first and can be filtered by status")
        void testFindByOwner() {
            Instant base = Instant.now().minusSeconds(30);
            store.insertIfAbsent(PaymentTransaction.create("LIP1", owner, new BigDecimal("20"), "basic", null, base),
                    windowStart());
            store.insertIfAbsent(PaymentTransaction.create("LIP2", owner, new BigDecimal("50"), "basic", null,
                    base.plusSeconds(10)), windowStart());
            store.insertIfAbsent(PaymentTransaction.create("LIP3", owner, new BigDecimal("70"), "premium", null,
                    base.plusSeconds(20)), windowStart());
            store.insertIfAbsent(PaymentTransaction.create("LIP4", "someone-else", new BigDecimal("20"), "basic", null,
                    base.plusSeconds(25)), windowStart());
            store.compareAndSet("LIP2", t -> true, t -> t.acceptedByGateway("ws_2", Instant.now()));

            assertEquals(List.of("LIP3", "LIP2", "LIP1"),
                    store.findByOwner(owner, null, 10).stream().map(PaymentTransaction::getCheckoutId).toList());
            assertEquals(List.of("LIP3", "LIP1"),
                    store.findByOwner(owner, TransactionStatus.QUEUED, 10).stream()
                            .map(PaymentTransaction::getCheckoutId).toList());
            assertEquals(List.of("LIP3"),
                    store.findByOwner(owner, null, 1).stream().map(PaymentTransaction::getCheckoutId).toList());
        }
    }

    @Nested
    @DisplayName("Outbox")
    class OutboxTests {

        @Test
        @DisplayName("Every status change writes one PaymentStatusChanged event, in order")
        void testStatusChangesWrittenToOutbox() throws Exception {
            printTestHeader("Status changes in the outbox");
            store.insertIfAbsent(candidate("LIP1"), windowStart());
            store.compareAndSet("LIP1", t -> true, t -> t.acceptedByGateway("ws_CO_1", Instant.now()));
            store.compareAndSet("LIP1", t -> true, t -> t.beginCredit("MPESA123", Instant.now()));
            store.compareAndSet("LIP1", t -> true, t -> t.creditSucceeded(Instant.now()));

            List<OutboxEvent> events = outboxService.getEventsForAggregate(JpaTransactionStore.AGGREGATE_TYPE, "LIP1");
            List<String> statuses = new ArrayList<>();
            for (OutboxEvent event : events) {
                assertEquals(PaymentStatusChangedEvent.EVENT_TYPE, event.getEventType());
                JsonNode payload = objectMapper.readTree(event.getPayload());
                statuses.add(payload.get("status").asText());
            }
            printOutput("Statuses", statuses);

            // beginCredit keeps the status, so it writes no event
            assertEquals(List.of("queued", "processing", "completed"), statuses);
            JsonNode last = objectMapper.readTree(events.get(2).getPayload());
            assertEquals("processing", last.get("previousStatus").asText());
            assertEquals("MPESA123", last.get("reference").asText());
            printSuccess("Outbox holds the full status history");
        }
    }
}
