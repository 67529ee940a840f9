package com.tsc.payment.service;

/**
 * Result of applying one gateway callback.
 */
public enum CallbackOutcome {
    COMPLETED("success"),
    ALREADY_COMPLETED("success"),
    VALIDATION_FAILED("failed"),
    AMOUNT_MISMATCH("failed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    PAYMENT_NOT_FOUND("error"),
    // Strict mode: callback for a payment that already reached a terminal state
    IGNORED("ignored");

    private final String resultStatus;

    CallbackOutcome(String resultStatus) {
        this.resultStatus = resultStatus;
    }

    /** Value passed to the front end result page. */
    public String getResultStatus() {
        return resultStatus;
    }

    public boolean isSuccess() {
        return this == COMPLETED || this == ALREADY_COMPLETED;
    }
}
