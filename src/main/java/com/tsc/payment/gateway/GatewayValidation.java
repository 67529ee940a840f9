package com.tsc.payment.gateway;

import java.math.BigDecimal;

public class GatewayValidation {

    private final boolean success;
    private final String transactionId;
    private final BigDecimal amount;
    private final String currency;
    private final String rawResponse;
    private final String error;

    private GatewayValidation(boolean success, String transactionId, BigDecimal amount, String currency,
                              String rawResponse, String error) {
        this.success = success;
        this.transactionId = transactionId;
        this.amount = amount;
        this.currency = currency;
        this.rawResponse = rawResponse;
        this.error = error;
    }

    public static GatewayValidation valid(String transactionId, BigDecimal amount, String currency, String rawResponse) {
        return new GatewayValidation(true, transactionId, amount, currency, rawResponse, null);
    }

    public static GatewayValidation invalid(String error, String rawResponse) {
        return new GatewayValidation(false, null, null, null, rawResponse, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getTransactionId() {
        return transactionId;
    }

    /** Amount confirmed by the gateway, or null when it did not report one. */
    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    public String getRawResponse() {
        return rawResponse;
    }

    public String getError() {
        return error;
    }
}
