package com.flagship.mobile_payments.payment;

import com.flagship.mobile_payments.payment.exception.InvalidRequestException;
import com.flagship.mobile_payments.payment.exception.TransactionNotFoundException;
import com.flagship.mobile_payments.reconcile.TransitionService;
import com.flagship.mobile_payments.transaction.PaymentTransaction;
import com.flagship.mobile_payments.transaction.TransactionStatus;
import com.flagship.mobile_payments.transaction.TransactionStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Client-facing reads and cancels. Never calls the gateway.
 */
@Service
public class PaymentStatusService {

    private final TransactionStore store;
    private final TransitionService transitionService;
    private final int historyLimit;

    public PaymentStatusService(TransactionStore store,
                                TransitionService transitionService,
                                @Value("${payments.history-limit:50}") int historyLimit) {
        this.store = store;
        this.transitionService = transitionService;
        this.historyLimit = historyLimit;
    }

    /**
     * Looks the transaction up by local checkout id, then by the gateway's id,
     * since clients sometimes only hold the id shown on the phone prompt.
     *
     * @throws TransactionNotFoundException if neither id matches
     */
    public PaymentTransaction getStatus(String checkoutId) {
        return store.findByCheckoutId(checkoutId)
                .or(() -> store.findByRemoteCheckoutId(checkoutId))
                .orElseThrow(() -> new TransactionNotFoundException(checkoutId));
    }

    /**
     * Payment history of one owner, newest first.
     *
     * @param status wire name to filter on, or null for every status
     * @throws InvalidRequestException if the owner is blank or the status unknown
     */
    public List<PaymentTransaction> history(String ownerReference, String status) {
        if (ownerReference == null || ownerReference.isBlank()) {
            throw new InvalidRequestException("Owner reference is required");
        }
        TransactionStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = TransactionStatus.fromWire(status)
                    .orElseThrow(() -> new InvalidRequestException("Unknown status: " + status));
        }
        return store.findByOwner(ownerReference.trim(), filter, historyLimit);
    }

    public PaymentTransaction cancel(String checkoutId) {
        return transitionService.cancel(checkoutId);
    }
}
