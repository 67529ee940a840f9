package com.tsc.payment.gateway;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the hosted gateway needs to open a payment session. The amount always comes from
 * the workshop fee, never from the client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayPaymentRequest {
    private BigDecimal amount;
    private String currency;
    private String transactionId;
    private GatewayCustomer customer;
    private String productName;
    private CallbackUrls callbackUrls;
    // Echoed back by the gateway as value_a / value_b
    private String registrationNumber;
    private Long workshopId;
}
