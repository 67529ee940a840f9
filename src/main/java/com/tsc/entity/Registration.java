package com.tsc.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "registrations", uniqueConstraints = {
        @UniqueConstraint(name = "uk_registration_email_workshop", columnNames = {"email", "workshop_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Registration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // REG-YYYYMMDD-XXXXX, assigned once by the ledger
    @Column(nullable = false, unique = true, updatable = false, length = 20)
    private String registrationNumber;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "workshop_id", nullable = false)
    private Workshop workshop;

    @Column(nullable = false, length = 200)
    private String studentName;

    @Column(nullable = false)
    private int grade;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "school_id")
    private School school;

    // Pre-normalization free text; only read by the school backfill
    @Column(name = "school_name", length = 200)
    private String legacySchoolName;

    @Column(nullable = false, length = 20)
    private String contactNumber;

    @Column(nullable = false)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RegistrationStatus paymentStatus = RegistrationStatus.PENDING;

    @Column(nullable = false, updatable = false)
    private LocalDateTime registeredAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (registrationNumber == null) {
            throw new IllegalStateException("Registration number must be assigned before persisting");
        }
        LocalDateTime now = LocalDateTime.now();
        registeredAt = now;
        updatedAt = now;
        applyFreeWorkshopStatus();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        applyFreeWorkshopStatus();
    }

    private void applyFreeWorkshopStatus() {
        if (workshop != null && workshop.isFree()) {
            paymentStatus = RegistrationStatus.FREE;
        }
    }

    public String getSchoolDisplayName() {
        if (school != null) {
            return school.getName();
        }
        return legacySchoolName != null ? legacySchoolName : "";
    }

    public boolean isReceiptAvailable() {
        return paymentStatus.isConfirmed();
    }
}
