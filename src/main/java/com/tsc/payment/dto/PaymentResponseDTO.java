package com.tsc.payment.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.tsc.payment.entity.Payment;
import com.tsc.payment.entity.PaymentMethod;
import com.tsc.payment.entity.PaymentStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payment as shown to administrators. The raw gateway payload is not included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponseDTO {

    private Long id;
    private String transactionId;
    private String registrationNumber;
    private String studentName;
    private String workshopName;
    private BigDecimal amount;
    private String currency;
    private PaymentStatus status;
    private PaymentMethod paymentMethod;
    private String validationId;
    private LocalDateTime initiatedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;

    public static PaymentResponseDTO fromEntity(Payment payment) {
        return PaymentResponseDTO.builder()
            .id(payment.getId())
            .transactionId(payment.getTransactionId())
            .registrationNumber(payment.getRegistration().getRegistrationNumber())
            .studentName(payment.getRegistration().getStudentName())
            .workshopName(payment.getRegistration().getWorkshop().getName())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .status(payment.getStatus())
            .paymentMethod(payment.getPaymentMethod())
            .validationId(payment.getValidationId())
            .initiatedAt(payment.getInitiatedAt())
            .completedAt(payment.getCompletedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
