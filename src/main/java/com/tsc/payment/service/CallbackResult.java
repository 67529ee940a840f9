package com.tsc.payment.service;

import com.tsc.payment.entity.Payment;

public class CallbackResult {

    private final CallbackOutcome outcome;
    private final Payment payment;

    private CallbackResult(CallbackOutcome outcome, Payment payment) {
        this.outcome = outcome;
        this.payment = payment;
    }

    public static CallbackResult of(CallbackOutcome outcome, Payment payment) {
        return new CallbackResult(outcome, payment);
    }

    public static CallbackResult notFound() {
        return new CallbackResult(CallbackOutcome.PAYMENT_NOT_FOUND, null);
    }

    public CallbackOutcome getOutcome() {
        return outcome;
    }

    /** Null when no payment matched the transaction id. */
    public Payment getPayment() {
        return payment;
    }

    public String getRegistrationNumber() {
        return payment != null ? payment.getRegistration().getRegistrationNumber() : null;
    }
}
