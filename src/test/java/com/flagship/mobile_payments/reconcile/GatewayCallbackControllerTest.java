package com.flagship.mobile_payments.reconcile;

import com.flagship.mobile_payments.gateway.GatewayOutcome;
import com.flagship.mobile_payments.observability.PaymentMetrics;
import com.flagship.mobile_payments.payment.exception.UnknownTransactionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Callback endpoint tests: every callback is acknowledged with 200, usable
 * ones are handed to the reconciler.
 */
@WebMvcTest(GatewayCallbackController.class)
class GatewayCallbackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StatusReconciler reconciler;

    @MockBean
    private PaymentMetrics metrics;

    @Test
    @DisplayName("Provider-style success callback is applied as COMPLETED")
    void testSuccessCallback() throws Exception {
        when(reconciler.applyOutcome("ws_CO_1", GatewayOutcome.COMPLETED, "MPESA123", null))
                .thenReturn(TransitionResult.APPLIED);

        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Correlation-ID", "corr-1")
                        .content("{\"CheckoutRequestID\":\"ws_CO_1\",\"status\":\"success\",\"refference\":\"MPESA123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("received"))
                .andExpect(header().string("X-Correlation-ID", "corr-1"));

        verify(reconciler).applyOutcome("ws_CO_1", GatewayOutcome.COMPLETED, "MPESA123", null);
        verify(metrics).recordCallback("applied");
    }

    @Test
    @DisplayName("Boolean failure flag with a reason is applied as FAILED")
    void testFailureCallback() throws Exception {
        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"remote_checkout_id\":\"ws_CO_1\",\"success\":false,\"reason\":\"insufficient funds\"}"))
                .andExpect(status().isOk());

        verify(reconciler).applyOutcome("ws_CO_1", GatewayOutcome.FAILED, null, "insufficient funds");
    }

    @Test
    @DisplayName("Unrecognised outcome for a known id is applied as ERROR")
    void testUnrecognisedOutcome() throws Exception {
        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"CheckoutRequestID\":\"ws_CO_1\",\"status\":\"mystery\"}"))
                .andExpect(status().isOk());

        verify(reconciler).applyOutcome(eq("ws_CO_1"), eq(GatewayOutcome.ERROR), any(),
                startsWith("malformed gateway callback"));
    }

    @Test
    @DisplayName("Unknown checkout id is acknowledged and counted")
    void testUnknownId() throws Exception {
        when(reconciler.applyOutcome(anyString(), any(), any(), any()))
                .thenThrow(new UnknownTransactionException("ws_CO_404"));

        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"CheckoutRequestID\":\"ws_CO_404\",\"status\":\"success\"}"))
                .andExpect(status().isOk());

        verify(metrics).recordCallback("unknown");
    }

    @Test
    @DisplayName("Malformed body is acknowledged without touching any transaction")
    void testMalformedBody() throws Exception {
        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{oops"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"success\"}"))
                .andExpect(status().isOk());

        verify(reconciler, never()).applyOutcome(any(), any(), any(), any());
    }
}
