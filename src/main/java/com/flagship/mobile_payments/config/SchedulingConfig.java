package com.flagship.mobile_payments.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the background loops (dispatch, poll, credit recovery, sweeper,
 * outbox publisher, metrics). Tests switch all of them off with
 * scheduling.enabled=false and drive the loops by hand.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
