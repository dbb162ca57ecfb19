package com.flagship.mobile_payments.credit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls the account service's credit endpoint over HTTP.
 */
@Component
@Slf4j
public class RestBalanceCreditHook implements BalanceCreditHook {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestTemplate restTemplate;
    private final String creditUrl;

    public RestBalanceCreditHook(@Qualifier("creditHookRestTemplate") RestTemplate restTemplate,
                                 @Value("${credit.hook.url}") String creditUrl) {
        this.restTemplate = restTemplate;
        this.creditUrl = creditUrl;
    }

    @Override
    public void credit(CreditRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_KEY_HEADER, request.getCheckoutId());

        try {
            ResponseEntity<Void> response = restTemplate.postForEntity(
                    creditUrl, new HttpEntity<>(request, headers), Void.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new CreditHookFailureException("Credit hook answered " + response.getStatusCode());
            }
            log.info("Credited plan {} to owner {} for checkoutId={}",
                    request.getPlanReference(), request.getOwnerReference(), request.getCheckoutId());
        } catch (RestClientException e) {
            throw new CreditHookFailureException("Credit hook call failed: " + e.getMessage(), e);
        }
    }
}
