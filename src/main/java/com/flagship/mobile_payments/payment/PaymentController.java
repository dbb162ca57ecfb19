package com.flagship.mobile_payments.payment;

import com.flagship.mobile_payments.observability.CorrelationContext;
import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.payment.dto.EnqueuePaymentRequest;
import com.flagship.mobile_payments.payment.dto.EnqueuePaymentResponse;
import com.flagship.mobile_payments.payment.dto.PaymentHistoryEntry;
import com.flagship.mobile_payments.payment.dto.PaymentStatusResponse;
import com.flagship.mobile_payments.payment.exception.DuplicateRequestException;
import com.flagship.mobile_payments.payment.exception.InvalidRequestException;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Client API: enqueue a payment, poll its status, cancel it, list an owner's
 * payment history.
 *
 * None of these endpoints waits on the gateway. Clients poll
 * GET /status/{checkout_id} until the status is terminal.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentQueueService queueService;
    private final PaymentStatusService statusService;
    private final PaymentMetrics paymentMetrics;

    @PostMapping
    public ResponseEntity<EnqueuePaymentResponse> enqueue(@Valid @RequestBody EnqueuePaymentRequest request) {
        long startTime = System.nanoTime();
        log.info("Received payment request: owner={}, plan={}, amount={}",
                request.getOwnerReference(), request.getPlanReference(), request.getAmount());

        int status = HttpStatus.ACCEPTED.value();
        try {
            PaymentTransaction queued = queueService.enqueue(
                    request.getOwnerReference(),
                    request.getAmount(),
                    request.getPlanReference(),
                    request.getPhoneNumber());

            CorrelationContext.tagCheckout(queued.getCheckoutId());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(EnqueuePaymentResponse.from(queued));
        } catch (InvalidRequestException e) {
            status = HttpStatus.BAD_REQUEST.value();
            throw e;
        } catch (DuplicateRequestException e) {
            status = HttpStatus.CONFLICT.value();
            throw e;
        } catch (RuntimeException e) {
            status = HttpStatus.INTERNAL_SERVER_ERROR.value();
            throw e;
        } finally {
            paymentMetrics.recordApiDuration("/api/payments", "POST", status, Duration.ofNanos(System.nanoTime() - startTime));
            CorrelationContext.untagCheckout();
        }
    }

    @GetMapping
    public ResponseEntity<List<PaymentHistoryEntry>> history(
            @RequestParam(name = "owner_reference") String ownerReference,
            @RequestParam(name = "status", required = false) String status) {
        List<PaymentHistoryEntry> entries = statusService.history(ownerReference, status).stream()
                .map(PaymentHistoryEntry::from)
                .toList();
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/status/{checkoutId}")
    public ResponseEntity<PaymentStatusResponse> status(@PathVariable("checkoutId") String checkoutId) {
        CorrelationContext.tagCheckout(checkoutId);
        try {
            return ResponseEntity.ok(PaymentStatusResponse.from(statusService.getStatus(checkoutId)));
        } finally {
            CorrelationContext.untagCheckout();
        }
    }

    @PostMapping("/cancel/{checkoutId}")
    public ResponseEntity<PaymentStatusResponse> cancel(@PathVariable("checkoutId") String checkoutId) {
        CorrelationContext.tagCheckout(checkoutId);
        try {
            log.info("Cancel requested for checkoutId={}", checkoutId);
            return ResponseEntity.ok(PaymentStatusResponse.from(statusService.cancel(checkoutId)));
        } finally {
            CorrelationContext.untagCheckout();
        }
    }
}
