package com.flagship.mobile_payments.reconcile;

import com.flagship.mobile_payments.gateway.GatewayOutcome;
import com.flagship.mobile_payments.observability.CorrelationContext;
import com.flagship.mobile_payments.payment.exception.UnknownTransactionException;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves a gateway-side checkout id to a local transaction and hands the
 * outcome to {@link TransitionService}. Used by both the callback endpoint and
 * the status poller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusReconciler {

    private final TransactionStore store;
    private final TransitionService transitionService;

    /**
     * @param gatewayCheckoutId remote checkout id, or the local checkout id
     *                          echoed back by the gateway as reference
     * @throws UnknownTransactionException if neither id matches a transaction
     */
    public TransitionResult applyOutcome(String gatewayCheckoutId, GatewayOutcome outcome,
                                         String reference, String message) {
        PaymentTransaction transaction = resolve(gatewayCheckoutId);

        CorrelationContext.tagCheckout(transaction.getCheckoutId());
        try {
            TransitionResult result = transitionService.apply(transaction.getCheckoutId(), outcome, reference, message);
            log.info("Applied gateway outcome {} to checkoutId={}: {}", outcome, transaction.getCheckoutId(), result);
            return result;
        } finally {
            CorrelationContext.untagCheckout();
        }
    }

    private PaymentTransaction resolve(String gatewayCheckoutId) {
        if (gatewayCheckoutId == null || gatewayCheckoutId.isBlank()) {
            throw new UnknownTransactionException(String.valueOf(gatewayCheckoutId));
        }
        return store.findByRemoteCheckoutId(gatewayCheckoutId)
                .or(() -> store.findByCheckoutId(gatewayCheckoutId))
                .orElseThrow(() -> new UnknownTransactionException(gatewayCheckoutId));
    }
}
