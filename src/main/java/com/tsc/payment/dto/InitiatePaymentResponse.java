package com.tsc.payment.dto;

import com.tsc.payment.service.PaymentInitiationResult;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InitiatePaymentResponse {
    private String status;
    private String registrationNumber;
    private String redirectUrl;
    private String message;

    public static InitiatePaymentResponse from(PaymentInitiationResult result) {
        return new InitiatePaymentResponse(result.getStatus().name(), result.getRegistrationNumber(),
                result.getRedirectUrl(), result.getMessage());
    }
}
