package com.flagship.mobile_payments.gateway;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One push-payment prompt. checkoutId travels as the request reference so the
 * gateway can recognise a resubmission after a crash.
 */
@Value
public class PushRequest {
    String checkoutId;
    String msisdn;
    BigDecimal amount;
}
