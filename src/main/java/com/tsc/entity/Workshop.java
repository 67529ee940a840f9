package com.tsc.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "workshops")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Workshop {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 4000)
    private String description;

    // Free-form, e.g. "15-16 March 2026"
    @Column(name = "workshop_date", length = 200)
    private String workshopDate;

    @Column(name = "workshop_time", length = 100)
    private String time;

    @Column(length = 100)
    private String duration;

    @Column(length = 200)
    private String venue;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal fee = BigDecimal.ZERO;

    @Column(nullable = false)
    @Builder.Default
    private int capacity = 100;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(length = 200)
    private String organizer;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
        validateFeeAndCapacity();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        validateFeeAndCapacity();
    }

    private void validateFeeAndCapacity() {
        if (fee == null || fee.signum() < 0) {
            throw new IllegalStateException("Workshop fee must be zero or positive");
        }
        if (capacity < 0) {
            throw new IllegalStateException("Workshop capacity must not be negative");
        }
    }

    public boolean isFree() {
        return fee != null && fee.signum() == 0;
    }
}
