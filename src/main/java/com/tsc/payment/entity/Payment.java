package com.tsc.payment.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One gateway transaction for a paid registration.
 * <p>
 * Every status change goes through {@link #markCompleted(LocalDateTime)}, {@link #markFailed()}
 * or {@link #markCancelled()} so the owning registration's status is updated in the same unit
 * of work.
 */
@Entity
@Table(name = "payments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "registration_id", nullable = false, unique = true)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Registration registration;

    @Column(nullable = false, unique = true, length = 100)
    private String transactionId;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "BDT";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PaymentStatus status = PaymentStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PaymentMethod paymentMethod = PaymentMethod.GATEWAY;

    // Last raw gateway payload (initiation response, then validation response)
    @Column(length = 8000)
    private String gatewayResponse;

    // Checkout page of the open gateway session
    @Column(length = 500)
    private String redirectUrl;

    @Column(length = 100)
    private String validationId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime initiatedAt;

    private LocalDateTime completedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (initiatedAt == null) {
            initiatedAt = now;
        }
        updatedAt = now;
        validateCompletionTimestamp();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        validateCompletionTimestamp();
    }

    private void validateCompletionTimestamp() {
        if ((status == PaymentStatus.COMPLETED) != (completedAt != null)) {
            throw new IllegalStateException(
                String.format("Payment %s has status %s but completedAt %s", transactionId, status, completedAt));
        }
    }

    public void markCompleted(LocalDateTime when) {
        this.status = PaymentStatus.COMPLETED;
        this.completedAt = when;
        syncRegistration();
    }

    public void markFailed() {
        this.status = PaymentStatus.FAILED;
        this.completedAt = null;
        syncRegistration();
    }

    public void markCancelled() {
        this.status = PaymentStatus.CANCELLED;
        this.completedAt = null;
        syncRegistration();
    }

    private void syncRegistration() {
        registration.setPaymentStatus(RegistrationStatus.fromPaymentStatus(status));
    }

    public boolean isCompleted() {
        return status == PaymentStatus.COMPLETED;
    }
}
