package com.tsc.payment.gateway;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CallbackUrls {
    private String successUrl;
    private String failUrl;
    private String cancelUrl;

    public static CallbackUrls fromBase(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new CallbackUrls(base + "/api/payment/success", base + "/api/payment/fail", base + "/api/payment/cancel");
    }
}
