package com.flagship.mobile_payments.config;

import com.flagship.mobile_payments.gateway.GatewayRejectedException;
import com.flagship.mobile_payments.gateway.GatewayUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP clients for the two outbound collaborators (mobile-money gateway and
 * balance-credit hook) and the retry policy for gateway dispatch.
 */
@Configuration
public class GatewayClientConfig {

    public static final String DISPATCH_RETRY = "gatewayDispatch";

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder,
                                            @Value("${gateway.connect-timeout:5s}") Duration connectTimeout,
                                            @Value("${gateway.read-timeout:30s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean
    public RestTemplate creditHookRestTemplate(RestTemplateBuilder builder,
                                               @Value("${credit.hook.connect-timeout:5s}") Duration connectTimeout,
                                               @Value("${credit.hook.read-timeout:10s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    /**
     * Only GatewayUnavailableException is worth another attempt; a rejection
     * is permanent.
     */
    @Bean
    public RetryRegistry gatewayRetryRegistry(@Value("${dispatch.retry.max-attempts:3}") int maxAttempts,
                                              @Value("${dispatch.retry.initial-backoff:500ms}") Duration initialBackoff,
                                              @Value("${dispatch.retry.multiplier:2.0}") double multiplier) {
        RetryConfig dispatchRetry = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(GatewayUnavailableException.class)
                .ignoreExceptions(GatewayRejectedException.class)
                .build();

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(DISPATCH_RETRY, dispatchRetry);
        return registry;
    }
}
