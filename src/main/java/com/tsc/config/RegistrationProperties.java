package com.tsc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

@ConfigurationProperties(prefix = "registration")
@Getter
@Setter
public class RegistrationProperties {

    /**
     * Reserve a seat while a payment is in flight and ignore callbacks that would move a
     * payment out of a terminal state. Off by default.
     */
    private boolean strictMode = false;

    private String zone = "Asia/Dhaka";

    // Where the browser lands after the gateway callbacks
    private String frontendBaseUrl = "http://localhost:3000";

    private String mailFrom = "noreply@titanium.sjis.edu.bd";

    private String organizationName = "Titanium Science Club";
}
