package com.flagship.mobile_payments.payment;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Plans a payment may be made for. Plan references are compared case-sensitively
 * after trimming; the configured names are the canonical spelling.
 */
@Component
public class PlanCatalog {

    private final Set<String> plans;

    public PlanCatalog(@Value("${payments.plans:basic,premium}") List<String> plans) {
        this.plans = plans.stream()
                .map(String::trim)
                .filter(plan -> !plan.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isRecognised(String planReference) {
        return planReference != null && plans.contains(planReference.trim());
    }

    public String describe() {
        return plans.stream().sorted().collect(Collectors.joining(", "));
    }
}
