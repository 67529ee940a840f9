package com.tsc.payment.gateway;

import java.math.BigDecimal;

/**
 * Contract for a hosted payment provider. Implementations report every transport or provider
 * failure through the returned result; nothing is thrown past this boundary.
 */
public interface PaymentGateway {

    /** Short provider id, e.g. {@code "sslcommerz"}. */
    String providerId();

    /**
     * Opens a payment session and returns the page the customer must be redirected to.
     */
    GatewayInitiation initiate(GatewayPaymentRequest request);

    /**
     * Asks the provider to confirm a payment reported by a success callback.
     */
    GatewayValidation validate(String validationId, String transactionId);

    /**
     * Exact decimal comparison after bringing both values to the same scale. Unparseable or
     * missing input never matches.
     */
    default boolean amountsMatch(String received, BigDecimal expected) {
        if (received == null || expected == null) {
            return false;
        }
        try {
            return amountsMatch(new BigDecimal(received.trim()), expected);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    default boolean amountsMatch(BigDecimal received, BigDecimal expected) {
        if (received == null || expected == null) {
            return false;
        }
        return received.compareTo(expected) == 0;
    }
}
