package com.flagship.mobile_payments.reconcile;

import com.flagship.mobile_payments.credit.BalanceCreditHook;
import com.flagship.mobile_payments.credit.CreditHookFailureException;
import com.flagship.mobile_payments.credit.CreditRequest;
import com.flagship.mobile_payments.gateway.GatewayOutcome;
import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.payment.exception.TransactionAlreadyTerminalException;
import com.flagship.mobile_payments.payment.exception.TransactionNotFoundException;
import com.flagship.mobile_payments.transaction.CreditState;
import com.flagship.mobile_payments.transaction.InMemoryTransactionStore;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Transition rules under every outcome source.
 *
 * These tests verify that:
 * - COMPLETED credits the balance exactly once, however many times it is reported
 * - A credit failure holds the transaction until retry or exhaustion
 * - Late outcomes never move a terminal transaction
 * - Client cancels respect terminal and in-flight credit states
 */
class TransitionServiceTest {

    private static final int MAX_CREDIT_ATTEMPTS = 2;

    private InMemoryTransactionStore store;
    private BalanceCreditHook creditHook;
    private TransitionService transitionService;

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
        store = new InMemoryTransactionStore();
        creditHook = mock(BalanceCreditHook.class);
        transitionService = new TransitionService(store, creditHook,
                new PaymentMetrics(new SimpleMeterRegistry()), MAX_CREDIT_ATTEMPTS, Clock.systemUTC());
    }

    private PaymentTransaction seedQueued(String checkoutId) {
        return store.save(PaymentTransaction.create(checkoutId, "user1", new BigDecimal("20"), "basic", "0712345678", Instant.now()));
    }

    private PaymentTransaction seedProcessing(String checkoutId, String remoteId) {
        return store.save(PaymentTransaction.create(checkoutId, "user1", new BigDecimal("20"), "basic", "0712345678", Instant.now())
                .acceptedByGateway(remoteId, Instant.now()));
    }

    @Nested
    @DisplayName("Completion and credit")
    class Completion {

        @Test
        @DisplayName("COMPLETED credits the owner once and stores the reference")
        void testHappyPath() {
            printTestHeader("COMPLETED credits the owner once");
            seedProcessing("abc", "ws_CO_1");

            TransitionResult result = transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);
            PaymentTransaction stored = store.get("abc");
            printOutput("Result", result);
            printOutput("Stored", stored.getStatus() + " ref=" + stored.getReference());

            ArgumentCaptor<CreditRequest> credit = ArgumentCaptor.forClass(CreditRequest.class);
            verify(creditHook, times(1)).credit(credit.capture());
            assertEquals("abc", credit.getValue().getCheckoutId());
            assertEquals("user1", credit.getValue().getOwnerReference());
            assertEquals("basic", credit.getValue().getPlanReference());
            assertEquals(0, new BigDecimal("20").compareTo(credit.getValue().getAmount()));

            assertEquals(TransitionResult.APPLIED, result);
            assertEquals(TransactionStatus.COMPLETED, stored.getStatus());
            assertEquals(CreditState.CREDITED, stored.getCreditState());
            assertEquals("MPESA123", stored.getReference());
            printSuccess("Completed with a single credit");
        }

        @Test
        @DisplayName("Duplicate COMPLETED is a no-op")
        void testDuplicateCompletion() {
            seedProcessing("abc", "ws_CO_1");

            transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);
            TransitionResult second = transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA999", null);

            assertEquals(TransitionResult.NO_OP, second);
            assertEquals("MPESA123", store.get("abc").getReference());
            verify(creditHook, times(1)).credit(any());
        }

        @Test
        @DisplayName("Concurrent COMPLETED outcomes credit exactly once")
        void testConcurrentCompletion() throws Exception {
            printTestHeader("Concurrent COMPLETED outcomes");
            seedProcessing("abc", "ws_CO_1");

            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<TransitionResult>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);
                }));
            }
            start.countDown();

            int applied = 0;
            for (Future<TransitionResult> result : results) {
                if (result.get(10, TimeUnit.SECONDS) == TransitionResult.APPLIED) {
                    applied++;
                }
            }
            executor.shutdown();
            printOutput("Applied", applied);

            assertEquals(1, applied);
            verify(creditHook, times(1)).credit(any());
            assertEquals(TransactionStatus.COMPLETED, store.get("abc").getStatus());
            printSuccess("One winner, one credit");
        }

        @Test
        @DisplayName("COMPLETED is ignored for a transaction still QUEUED")
        void testCompletionRequiresAcceptance() {
            seedQueued("abc");

            assertEquals(TransitionResult.NO_OP,
                    transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null));
            verify(creditHook, never()).credit(any());
        }

        @Test
        @DisplayName("Credit failure holds the status, retry completes it")
        void testCreditFailureThenRetry() {
            printTestHeader("Credit failure then retry");
            seedProcessing("abc", "ws_CO_1");
            doThrow(new CreditHookFailureException("hook down"))
                    .doNothing()
                    .when(creditHook).credit(any());

            TransitionResult first = transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);
            PaymentTransaction held = store.get("abc");
            printOutput("After failure", held.getStatus() + "/" + held.getCreditState());

            assertEquals(TransitionResult.CREDIT_FAILED, first);
            assertEquals(TransactionStatus.PROCESSING, held.getStatus());
            assertEquals(CreditState.FAILED, held.getCreditState());

            TransitionResult retried = transitionService.retryCredit("abc", Instant.now());
            PaymentTransaction completed = store.get("abc");
            printOutput("After retry", completed.getStatus() + "/" + completed.getCreditState());

            assertEquals(TransitionResult.APPLIED, retried);
            assertEquals(TransactionStatus.COMPLETED, completed.getStatus());
            assertEquals("MPESA123", completed.getReference());
            assertEquals(2, completed.getCreditAttempts());
            printSuccess("Credit recovered on retry");
        }

        @Test
        @DisplayName("Credit budget exhaustion ends in ERROR")
        void testCreditExhausted() {
            seedProcessing("abc", "ws_CO_1");
            doThrow(new CreditHookFailureException("hook down")).when(creditHook).credit(any());

            transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);
            TransitionResult last = transitionService.retryCredit("abc", Instant.now());
            PaymentTransaction error = store.get("abc");

            assertEquals(TransitionResult.CREDIT_FAILED, last);
            assertEquals(TransactionStatus.ERROR, error.getStatus());
            assertTrue(error.getErrorDetail().startsWith("credit failed after 2 attempts"));
            verify(creditHook, times(MAX_CREDIT_ATTEMPTS)).credit(any());
        }

        @Test
        @DisplayName("A fresh ATTEMPTING credit is not retried")
        void testFreshAttemptNotRetried() {
            store.save(PaymentTransaction.create("abc", "user1", new BigDecimal("20"), "basic", null, Instant.now())
                    .acceptedByGateway("ws_CO_1", Instant.now())
                    .beginCredit("MPESA123", Instant.now()));

            assertEquals(TransitionResult.NO_OP,
                    transitionService.retryCredit("abc", Instant.now().minusSeconds(120)));
            verify(creditHook, never()).credit(any());
        }

        @Test
        @DisplayName("FAILED outcome cannot close a transaction whose credit is in flight")
        void testFailureDuringCredit() {
            seedProcessing("abc", "ws_CO_1");
            doThrow(new CreditHookFailureException("hook down")).when(creditHook).credit(any());
            transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);

            assertEquals(TransitionResult.NO_OP,
                    transitionService.apply("abc", GatewayOutcome.FAILED, null, "insufficient funds"));
            assertEquals(TransactionStatus.PROCESSING, store.get("abc").getStatus());
        }
    }

    @Nested
    @DisplayName("Timestamps")
    class Timestamps {

        @Test
        @DisplayName("Every change is stamped by the injected clock")
        void testChangesUseInjectedClock() {
            Instant fixed = Instant.parse("2024-03-01T10:15:30Z");
            TransitionService fixedClockService = new TransitionService(store, creditHook,
                    new PaymentMetrics(new SimpleMeterRegistry()), MAX_CREDIT_ATTEMPTS, Clock.fixed(fixed, ZoneOffset.UTC));
            seedQueued("abc");

            fixedClockService.markProcessing("abc", "ws_CO_1");
            assertEquals(fixed, store.get("abc").getUpdatedAt());

            fixedClockService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);
            PaymentTransaction completed = store.get("abc");
            assertEquals(fixed, completed.getUpdatedAt());
            assertEquals(fixed, completed.getCreditAttemptedAt());
        }
    }

    @Nested
    @DisplayName("Other outcomes")
    class OtherOutcomes {

        @Test
        @DisplayName("PENDING moves PROCESSING to PENDING once")
        void testPending() {
            seedProcessing("abc", "ws_CO_1");

            assertEquals(TransitionResult.APPLIED, transitionService.apply("abc", GatewayOutcome.PENDING, null, null));
            assertEquals(TransitionResult.NO_OP, transitionService.apply("abc", GatewayOutcome.PENDING, null, null));
            assertEquals(TransactionStatus.PENDING, store.get("abc").getStatus());
        }

        @Test
        @DisplayName("FAILED keeps the gateway message as error detail")
        void testFailed() {
            seedProcessing("abc", "ws_CO_1");

            transitionService.apply("abc", GatewayOutcome.FAILED, null, "insufficient funds");

            PaymentTransaction failed = store.get("abc");
            assertEquals(TransactionStatus.FAILED, failed.getStatus());
            assertEquals("insufficient funds", failed.getErrorDetail());
        }

        @Test
        @DisplayName("CANCELLED without a message gets a default detail")
        void testCancelledDefaultDetail() {
            seedProcessing("abc", "ws_CO_1");

            transitionService.apply("abc", GatewayOutcome.CANCELLED, null, null);

            assertEquals("payment cancelled by user", store.get("abc").getErrorDetail());
        }

        @Test
        @DisplayName("Gateway failure outcomes cannot close a transaction that was never dispatched")
        void testFailureOutcomesIgnoreQueued() {
            printTestHeader("Failure outcomes on a QUEUED transaction");
            seedQueued("q-failed");
            seedQueued("q-error");
            seedQueued("q-cancelled");
            StatusReconciler reconciler = new StatusReconciler(store, transitionService);

            TransitionResult failed = reconciler.applyOutcome("q-failed", GatewayOutcome.FAILED, null, "declined");
            TransitionResult error = reconciler.applyOutcome("q-error", GatewayOutcome.ERROR, null,
                    "malformed gateway callback");
            TransitionResult cancelled = reconciler.applyOutcome("q-cancelled", GatewayOutcome.CANCELLED, null, null);
            printOutput("Results", failed + "/" + error + "/" + cancelled);

            assertEquals(TransitionResult.NO_OP, failed);
            assertEquals(TransitionResult.NO_OP, error);
            assertEquals(TransitionResult.NO_OP, cancelled);
            assertEquals(TransactionStatus.QUEUED, store.get("q-failed").getStatus());
            assertEquals(TransactionStatus.QUEUED, store.get("q-error").getStatus());
            assertEquals(TransactionStatus.QUEUED, store.get("q-cancelled").getStatus());
            printSuccess("Queued transactions stay queued until dispatched");
        }

        @Test
        @DisplayName("A queued transaction rejected early can still complete after dispatch")
        void testQueuedSurvivesEarlyFailureAndCompletes() {
            seedQueued("abc");
            transitionService.apply("abc", GatewayOutcome.ERROR, null, "malformed gateway callback");

            transitionService.markProcessing("abc", "ws_CO_1");
            TransitionResult completed = transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);

            assertEquals(TransitionResult.APPLIED, completed);
            assertEquals(TransactionStatus.COMPLETED, store.get("abc").getStatus());
            verify(creditHook, times(1)).credit(any());
        }

        @Test
        @DisplayName("Late COMPLETED after TIMEOUT is ignored")
        void testLateOutcomeAfterTimeout() {
            printTestHeader("Late COMPLETED after TIMEOUT");
            seedProcessing("abc", "ws_CO_1");
            assertTrue(transitionService.timeout("abc", "exceeded maximum processing time"));

            TransitionResult late = transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);
            printOutput("Late result", late);

            assertEquals(TransitionResult.NO_OP, late);
            assertEquals(TransactionStatus.TIMEOUT, store.get("abc").getStatus());
            verify(creditHook, never()).credit(any());
            printSuccess("Terminal status is final");
        }

        @Test
        @DisplayName("Timeout skips transactions with a credit in flight")
        void testTimeoutSkipsCredit() {
            store.save(PaymentTransaction.create("abc", "user1", new BigDecimal("20"), "basic", null, Instant.now())
                    .acceptedByGateway("ws_CO_1", Instant.now())
                    .beginCredit("MPESA123", Instant.now()));

            assertFalse(transitionService.timeout("abc", "exceeded maximum processing time"));
        }

        @Test
        @DisplayName("Dispatch failure only applies to QUEUED transactions")
        void testDispatchFailure() {
            seedQueued("abc");
            seedProcessing("def", "ws_CO_2");

            assertTrue(transitionService.markDispatchFailed("abc", TransactionStatus.ERROR, "boom").isPresent());
            assertTrue(transitionService.markDispatchFailed("def", TransactionStatus.ERROR, "boom").isEmpty());
            assertEquals(TransactionStatus.PROCESSING, store.get("def").getStatus());
        }
    }

    @Nested
    @DisplayName("Client cancel")
    class Cancel {

        @Test
        @DisplayName("QUEUED transaction can be cancelled")
        void testCancelQueued() {
            seedQueued("abc");

            PaymentTransaction cancelled = transitionService.cancel("abc");

            assertEquals(TransactionStatus.CANCELLED, cancelled.getStatus());
            assertEquals(TransitionService.CANCELLED_BY_CLIENT, cancelled.getErrorDetail());
        }

        @Test
        @DisplayName("Cancelling a completed transaction reports it as terminal")
        void testCancelCompleted() {
            printTestHeader("Cancel after completion");
            seedProcessing("abc", "ws_CO_1");
            transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);

            TransactionAlreadyTerminalException e = assertThrows(TransactionAlreadyTerminalException.class,
                    () -> transitionService.cancel("abc"));
            printOutput("Error", e.getMessage());

            assertEquals(TransactionStatus.COMPLETED, store.get("abc").getStatus());
            printSuccess("Completed transaction was not cancelled");
        }

        @Test
        @DisplayName("Cancelling while a credit is in flight is refused")
        void testCancelDuringCredit() {
            seedProcessing("abc", "ws_CO_1");
            doThrow(new CreditHookFailureException("hook down")).when(creditHook).credit(any());
            transitionService.apply("abc", GatewayOutcome.COMPLETED, "MPESA123", null);

            assertThrows(IllegalStateException.class, () -> transitionService.cancel("abc"));
        }

        @Test
        @DisplayName("Cancelling an unknown checkout id is not found")
        void testCancelUnknown() {
            assertThrows(TransactionNotFoundException.class, () -> transitionService.cancel("nope"));
        }
    }
}
