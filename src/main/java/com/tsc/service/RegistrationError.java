package com.tsc.service;

import org.springframework.http.HttpStatus;

/**
 * Reasons a registration request is refused. Input problems map to 400, problems with the
 * workshop or an existing registration to 409.
 */
public enum RegistrationError {
    WORKSHOP_CLOSED(HttpStatus.CONFLICT),
    WORKSHOP_FULL(HttpStatus.CONFLICT),
    INVALID_GRADE(HttpStatus.BAD_REQUEST),
    INVALID_PHONE(HttpStatus.BAD_REQUEST),
    INVALID_EMAIL(HttpStatus.BAD_REQUEST),
    DUPLICATE_REGISTRATION(HttpStatus.CONFLICT),
    TERMS_NOT_ACCEPTED(HttpStatus.BAD_REQUEST),
    INVALID_NAME(HttpStatus.BAD_REQUEST),
    UNKNOWN_SCHOOL(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;

    RegistrationError(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
