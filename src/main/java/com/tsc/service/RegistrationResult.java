package com.tsc.service;

import com.tsc.entity.Registration;

public class RegistrationResult {

    private final Registration registration;
    private final RegistrationError error;
    private final String message;

    private RegistrationResult(Registration registration, RegistrationError error, String message) {
        this.registration = registration;
        this.error = error;
        this.message = message;
    }

    public static RegistrationResult success(Registration registration) {
        return new RegistrationResult(registration, null, null);
    }

    public static RegistrationResult failure(RegistrationError error, String message) {
        return new RegistrationResult(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Registration getRegistration() {
        return registration;
    }

    public RegistrationError getError() {
        return error;
    }

    /** User-facing reason, null on success. */
    public String getMessage() {
        return message;
    }
}
