package com.tsc.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import lombok.Getter;
import lombok.Setter;

/**
 * Gateway credentials and endpoints, handed to the gateway adapter at construction.
 * Blank URLs fall back to the sandbox or live host selected by {@code sandbox}.
 */
@ConfigurationProperties(prefix = "sslcommerz")
@Getter
@Setter
public class SslCommerzProperties {

    static final String SANDBOX_API_URL = "https://sandbox.sslcommerz.com/gwprocess/v4/api.php";
    static final String SANDBOX_VALIDATION_URL = "https://sandbox.sslcommerz.com/validator/api/validationserverAPI.php";
    static final String LIVE_API_URL = "https://securepay.sslcommerz.com/gwprocess/v4/api.php";
    static final String LIVE_VALIDATION_URL = "https://securepay.sslcommerz.com/validator/api/validationserverAPI.php";

    private String storeId = "";

    private String storePassword = "";

    private boolean sandbox = true;

    private String apiUrl;

    private String validationUrl;

    private String currency = "BDT";

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration connectTimeout = Duration.ofSeconds(30);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration readTimeout = Duration.ofSeconds(30);

    public String resolveApiUrl() {
        if (apiUrl != null && !apiUrl.isBlank()) {
            return apiUrl;
        }
        return sandbox ? SANDBOX_API_URL : LIVE_API_URL;
    }

    public String resolveValidationUrl() {
        if (validationUrl != null && !validationUrl.isBlank()) {
            return validationUrl;
        }
        return sandbox ? SANDBOX_VALIDATION_URL : LIVE_VALIDATION_URL;
    }
}
