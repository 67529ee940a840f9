package com.tsc.payment.entity;

public enum PaymentMethod {
    GATEWAY,
    FREE
}
