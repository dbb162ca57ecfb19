package com.flagship.mobile_payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MobilePaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MobilePaymentsApplication.class, args);
    }
}
