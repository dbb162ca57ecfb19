package com.flagship.mobile_payments.payment;

import com.flagship.mobile_payments.payment.exception.InvalidRequestException;
import org.springframework.stereotype.Component;

/**
 * Normalises payer phone numbers to the gateway's local format (07XXXXXXXX).
 *
 * Accepts "+254 712 345 678", "254712345678", "0712345678" and "712345678".
 */
@Component
public class PhoneNumberFormatter {

    private static final String COUNTRY_CODE = "254";
    private static final int LOCAL_LENGTH = 10;

    public String format(String phoneNumber) {
        String digits = phoneNumber == null ? "" : phoneNumber.replaceAll("\\D", "");

        if (digits.startsWith(COUNTRY_CODE)) {
            digits = "0" + digits.substring(COUNTRY_CODE.length());
        }
        if (!digits.startsWith("0")) {
            digits = "0" + digits;
        }
        if (digits.length() > LOCAL_LENGTH) {
            digits = digits.substring(0, LOCAL_LENGTH);
        }

        if (digits.length() != LOCAL_LENGTH) {
            throw new InvalidRequestException("Phone number is not a valid mobile number: " + phoneNumber);
        }
        return digits;
    }
}
