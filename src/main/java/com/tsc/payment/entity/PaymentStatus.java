package com.tsc.payment.entity;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
