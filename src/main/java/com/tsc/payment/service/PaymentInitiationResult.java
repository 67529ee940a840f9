package com.tsc.payment.service;

public class PaymentInitiationResult {

    public enum Status {
        REDIRECT,
        FREE,
        ALREADY_COMPLETED,
        WORKSHOP_FULL,
        PAYMENT_IN_PROGRESS,
        GATEWAY_ERROR,
        NOT_FOUND
    }

    private final Status status;
    private final String registrationNumber;
    private final String redirectUrl;
    private final String transactionId;
    private final String message;

    private PaymentInitiationResult(Status status, String registrationNumber, String redirectUrl,
                                    String transactionId, String message) {
        this.status = status;
        this.registrationNumber = registrationNumber;
        this.redirectUrl = redirectUrl;
        this.transactionId = transactionId;
        this.message = message;
    }

    public static PaymentInitiationResult redirect(String registrationNumber, String redirectUrl, String transactionId) {
        return new PaymentInitiationResult(Status.REDIRECT, registrationNumber, redirectUrl, transactionId, null);
    }

    public static PaymentInitiationResult free(String registrationNumber) {
        return new PaymentInitiationResult(Status.FREE, registrationNumber, null, null,
                "This workshop is free. No payment is required.");
    }

    public static PaymentInitiationResult alreadyCompleted(String registrationNumber) {
        return new PaymentInitiationResult(Status.ALREADY_COMPLETED, registrationNumber, null, null,
                "Payment already completed for this registration.");
    }

    public static PaymentInitiationResult workshopFull(String registrationNumber, int capacity) {
        return new PaymentInitiationResult(Status.WORKSHOP_FULL, registrationNumber, null, null,
                "This workshop is full. Only " + capacity + " slots were available.");
    }

    public static PaymentInitiationResult paymentInProgress(String registrationNumber, String transactionId) {
        return new PaymentInitiationResult(Status.PAYMENT_IN_PROGRESS, registrationNumber, null, transactionId,
                "A payment for this registration is already in progress.");
    }

    public static PaymentInitiationResult gatewayError(String registrationNumber) {
        return new PaymentInitiationResult(Status.GATEWAY_ERROR, registrationNumber, null, null,
                "Payment could not be started. Please try again in a moment.");
    }

    public static PaymentInitiationResult notFound(String registrationNumber) {
        return new PaymentInitiationResult(Status.NOT_FOUND, registrationNumber, null, null,
                "Registration not found: " + registrationNumber);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isRedirect() {
        return status == Status.REDIRECT;
    }

    public String getRegistrationNumber() {
        return registrationNumber;
    }

    public String getRedirectUrl() {
        return redirectUrl;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getMessage() {
        return message;
    }
}
