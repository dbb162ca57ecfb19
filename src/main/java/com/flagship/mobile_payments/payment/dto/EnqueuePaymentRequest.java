package com.flagship.mobile_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnqueuePaymentRequest {

    @NotBlank(message = "Owner reference is required")
    @Size(max = 255, message = "Owner reference must be at most 255 characters")
    @JsonProperty("owner_reference")
    private String ownerReference;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    @JsonProperty("amount")
    private BigDecimal amount;

    @NotBlank(message = "Plan reference is required")
    @JsonProperty("plan_reference")
    private String planReference;

    @Size(max = 20, message = "Phone number must be at most 20 characters")
    @JsonProperty("phone_number")
    private String phoneNumber;
}
