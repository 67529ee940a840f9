package com.tsc.entity;

import com.tsc.payment.entity.PaymentStatus;

/**
 * Payment state of a registration as seen by the ledger.
 * <p>
 * {@link #FREE} exists only here; a registration for a paid workshop follows its
 * {@link PaymentStatus} through {@link #fromPaymentStatus(PaymentStatus)}, which is the
 * single place the two enums are mapped.
 */
public enum RegistrationStatus {
    PENDING("Pending"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELLED("Cancelled"),
    FREE("Free Workshop");

    private final String displayName;

    RegistrationStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Registrations in these states hold a workshop seat.
     */
    public boolean isConfirmed() {
        return this == COMPLETED || this == FREE;
    }

    public static RegistrationStatus fromPaymentStatus(PaymentStatus paymentStatus) {
        return switch (paymentStatus) {
            case PENDING -> PENDING;
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case CANCELLED -> CANCELLED;
        };
    }
}
