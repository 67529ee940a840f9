package com.tsc.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.entity.Workshop;
import com.tsc.payment.entity.Payment;
import com.tsc.payment.entity.PaymentStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationResponseDTO {

    private String registrationNumber;
    private Long workshopId;
    private String workshopName;
    private String workshopDate;
    private String workshopTime;
    private String venue;
    private BigDecimal fee;
    private boolean free;

    private String studentName;
    private int grade;
    private String school;
    private String contactNumber;
    private String email;

    private RegistrationStatus paymentStatus;
    private String paymentStatusDisplay;
    private boolean receiptAvailable;
    private LocalDateTime registeredAt;

    // Present once a checkout was started
    private String transactionId;
    private PaymentStatus paymentRecordStatus;
    private LocalDateTime paymentCompletedAt;

    public static RegistrationResponseDTO fromEntity(Registration registration) {
        return fromEntity(registration, null);
    }

    public static RegistrationResponseDTO fromEntity(Registration registration, Payment payment) {
        Workshop workshop = registration.getWorkshop();
        RegistrationResponseDTOBuilder builder = RegistrationResponseDTO.builder()
            .registrationNumber(registration.getRegistrationNumber())
            .workshopId(workshop.getId())
            .workshopName(workshop.getName())
            .workshopDate(workshop.getWorkshopDate())
            .workshopTime(workshop.getTime())
            .venue(workshop.getVenue())
            .fee(workshop.getFee())
            .free(workshop.isFree())
            .studentName(registration.getStudentName())
            .grade(registration.getGrade())
            .school(registration.getSchoolDisplayName())
            .contactNumber(registration.getContactNumber())
            .email(registration.getEmail())
            .paymentStatus(registration.getPaymentStatus())
            .paymentStatusDisplay(registration.getPaymentStatus().getDisplayName())
            .receiptAvailable(registration.isReceiptAvailable())
            .registeredAt(registration.getRegisteredAt());

        if (payment != null) {
            builder.transactionId(payment.getTransactionId())
                   .paymentRecordStatus(payment.getStatus())
                   .paymentCompletedAt(payment.getCompletedAt());
        }
        return builder.build();
    }
}
