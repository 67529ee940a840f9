package com.tsc.payment.controller;

import java.net.URI;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import org.springframework.web.util.UriComponentsBuilder;

import com.tsc.config.RegistrationProperties;
import com.tsc.payment.dto.InitiatePaymentResponse;
import com.tsc.payment.gateway.CallbackUrls;
import com.tsc.payment.service.CallbackResult;
import com.tsc.payment.service.PaymentInitiationResult;
import com.tsc.payment.service.PaymentLifecycleService;

import lombok.extern.slf4j.Slf4j;

/**
 * Checkout start plus the three gateway callbacks. The callbacks are posted by the gateway
 * as form data and always answer with a redirect to the front end result page.
 */
@RestController
@Slf4j
public class PaymentController {

    private static final String STATUS_ERROR = "error";

    @Autowired
    private PaymentLifecycleService paymentLifecycleService;

    @Autowired
    private RegistrationProperties registrationProperties;

    @PostMapping("/api/registrations/{registrationNumber}/payment")
    public ResponseEntity<InitiatePaymentResponse> initiatePayment(@PathVariable String registrationNumber) {
        log.info("Payment initiation requested for {}", registrationNumber);
        CallbackUrls callbackUrls = CallbackUrls.fromBase(
                ServletUriComponentsBuilder.fromCurrentContextPath().toUriString());

        PaymentInitiationResult result = paymentLifecycleService.initiate(registrationNumber, callbackUrls);
        InitiatePaymentResponse body = InitiatePaymentResponse.from(result);

        switch (result.getStatus()) {
            case REDIRECT:
            case FREE:
            case ALREADY_COMPLETED:
                return ResponseEntity.ok(body);
            case NOT_FOUND:
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
            case WORKSHOP_FULL:
            case PAYMENT_IN_PROGRESS:
                return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
            case GATEWAY_ERROR:
            default:
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
        }
    }

    @PostMapping("/api/payment/success")
    public ResponseEntity<Void> paymentSuccess(@RequestParam(name = "tran_id", required = false) String transactionId,
                                               @RequestParam(name = "val_id", required = false) String validationId,
                                               @RequestParam(name = "amount", required = false) String amount,
                                               @RequestParam(name = "value_a", required = false) String registrationNumber) {
        log.info("Success callback received for transaction: {} (registration: {})", transactionId, registrationNumber);
        try {
            return redirect(paymentLifecycleService.handleSuccessCallback(validationId, transactionId, amount));
        } catch (RuntimeException e) {
            log.error("Error processing success callback for transaction {}", transactionId, e);
            return redirectError();
        }
    }

    @PostMapping("/api/payment/fail")
    public ResponseEntity<Void> paymentFail(@RequestParam(name = "tran_id", required = false) String transactionId) {
        log.info("Fail callback received for transaction: {}", transactionId);
        try {
            return redirect(paymentLifecycleService.handleFailCallback(transactionId));
        } catch (RuntimeException e) {
            log.error("Error processing fail callback for transaction {}", transactionId, e);
            return redirectError();
        }
    }

    @PostMapping("/api/payment/cancel")
    public ResponseEntity<Void> paymentCancel(@RequestParam(name = "tran_id", required = false) String transactionId) {
        log.info("Cancel callback received for transaction: {}", transactionId);
        try {
            return redirect(paymentLifecycleService.handleCancelCallback(transactionId));
        } catch (RuntimeException e) {
            log.error("Error processing cancel callback for transaction {}", transactionId, e);
            return redirectError();
        }
    }

    private ResponseEntity<Void> redirect(CallbackResult result) {
        return seeOther(result.getOutcome().getResultStatus(), result.getRegistrationNumber());
    }

    private ResponseEntity<Void> redirectError() {
        return seeOther(STATUS_ERROR, null);
    }

    private ResponseEntity<Void> seeOther(String status, String registrationNumber) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(registrationProperties.getFrontendBaseUrl())
                .path("/payment/result")
                .queryParam("status", status);
        if (registrationNumber != null) {
            builder.queryParam("registration", registrationNumber);
        }
        URI location = builder.encode().build().toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setLocation(location);
        return new ResponseEntity<>(headers, HttpStatus.SEE_OTHER);
    }
}
