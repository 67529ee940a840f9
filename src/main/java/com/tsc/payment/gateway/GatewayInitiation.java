package com.tsc.payment.gateway;

public class GatewayInitiation {

    private final boolean success;
    private final String redirectUrl;
    private final String rawResponse;
    private final String error;

    private GatewayInitiation(boolean success, String redirectUrl, String rawResponse, String error) {
        this.success = success;
        this.redirectUrl = redirectUrl;
        this.rawResponse = rawResponse;
        this.error = error;
    }

    public static GatewayInitiation success(String redirectUrl, String rawResponse) {
        return new GatewayInitiation(true, redirectUrl, rawResponse, null);
    }

    public static GatewayInitiation failure(String error, String rawResponse) {
        return new GatewayInitiation(false, null, rawResponse, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getRedirectUrl() {
        return redirectUrl;
    }

    public String getRawResponse() {
        return rawResponse;
    }

    public String getError() {
        return error;
    }
}
