package com.tsc.payment.service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.tsc.config.RegistrationProperties;
import com.tsc.config.SslCommerzProperties;
import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.entity.Workshop;
import com.tsc.payment.entity.Payment;
import com.tsc.payment.entity.PaymentStatus;
import com.tsc.payment.gateway.CallbackUrls;
import com.tsc.payment.gateway.GatewayCustomer;
import com.tsc.payment.gateway.GatewayInitiation;
import com.tsc.payment.gateway.GatewayPaymentRequest;
import com.tsc.payment.gateway.GatewayValidation;
import com.tsc.payment.gateway.PaymentGateway;
import com.tsc.repository.IRegistrationRepository;
import com.tsc.service.NotificationService;
import com.tsc.service.WorkshopService;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives a paid registration through checkout: opens the gateway session, then applies the
 * success, fail and cancel callbacks.
 * <p>
 * Gateway calls are made outside any database transaction. State changes are committed by
 * {@link PaymentRecordService}; confirmation mail is sent only after a commit that actually
 * completed the payment.
 */
@Service
@Slf4j
public class PaymentLifecycleService {

    private final PaymentGateway paymentGateway;
    private final PaymentRecordService paymentRecordService;
    private final IRegistrationRepository registrationRepository;
    private final WorkshopService workshopService;
    private final NotificationService notificationService;
    private final RegistrationProperties registrationProperties;
    private final SslCommerzProperties gatewayProperties;

    public PaymentLifecycleService(PaymentGateway paymentGateway,
                                   PaymentRecordService paymentRecordService,
                                   IRegistrationRepository registrationRepository,
                                   WorkshopService workshopService,
                                   NotificationService notificationService,
                                   RegistrationProperties registrationProperties,
                                   SslCommerzProperties gatewayProperties) {
        this.paymentGateway = paymentGateway;
        this.paymentRecordService = paymentRecordService;
        this.registrationRepository = registrationRepository;
        this.workshopService = workshopService;
        this.notificationService = notificationService;
        this.registrationProperties = registrationProperties;
        this.gatewayProperties = gatewayProperties;
    }

    public PaymentInitiationResult initiate(String registrationNumber, CallbackUrls callbackUrls) {
        Optional<Registration> registrationOpt = registrationRepository.findByRegistrationNumber(registrationNumber);
        if (registrationOpt.isEmpty()) {
            log.warn("Payment requested for unknown registration {}", registrationNumber);
            return PaymentInitiationResult.notFound(registrationNumber);
        }

        Registration registration = registrationOpt.get();
        Workshop workshop = registration.getWorkshop();

        if (workshop.isFree() || registration.getPaymentStatus() == RegistrationStatus.FREE) {
            return PaymentInitiationResult.free(registrationNumber);
        }
        if (registration.getPaymentStatus() == RegistrationStatus.COMPLETED) {
            log.info("Payment for {} already completed, not opening a new session", registrationNumber);
            return PaymentInitiationResult.alreadyCompleted(registrationNumber);
        }

        // A pending session is resumed, never replaced
        Optional<Payment> pending = paymentRecordService.findByRegistrationId(registration.getId())
                .filter(p -> p.getStatus() == PaymentStatus.PENDING);
        if (pending.isPresent()) {
            return resume(registrationNumber, pending.get());
        }

        if (registrationProperties.isStrictMode() && !hasSeat(workshop)) {
            log.info("Payment for {} refused, workshop {} is full", registrationNumber, workshop.getId());
            return PaymentInitiationResult.workshopFull(registrationNumber, workshop.getCapacity());
        }

        String transactionId = newTransactionId(registrationNumber);
        BigDecimal amount = workshop.getFee();
        String currency = gatewayProperties.getCurrency();

        GatewayPaymentRequest request = GatewayPaymentRequest.builder()
                .amount(amount)
                .currency(currency)
                .transactionId(transactionId)
                .customer(GatewayCustomer.builder()
                        .name(registration.getStudentName())
                        .email(registration.getEmail())
                        .phone(registration.getContactNumber())
                        .address(registration.getSchoolDisplayName())
                        .build())
                .productName(workshop.getName())
                .callbackUrls(callbackUrls)
                .registrationNumber(registrationNumber)
                .workshopId(workshop.getId())
                .build();

        GatewayInitiation initiation = paymentGateway.initiate(request);
        if (!initiation.isSuccess()) {
            log.error("Gateway {} refused session for {} ({}): {}", paymentGateway.providerId(),
                    registrationNumber, transactionId, initiation.getError());
            return PaymentInitiationResult.gatewayError(registrationNumber);
        }

        Payment payment = paymentRecordService.recordInitiatedPayment(registration.getId(), transactionId, amount,
                currency, initiation.getRedirectUrl(), initiation.getRawResponse());
        if (!transactionId.equals(payment.getTransactionId())) {
            log.warn("Concurrent session {} kept for {}, dropping {}", payment.getTransactionId(),
                    registrationNumber, transactionId);
            return resume(registrationNumber, payment);
        }
        log.info("Redirecting {} to gateway for transaction {}", registrationNumber, transactionId);
        return PaymentInitiationResult.redirect(registrationNumber, initiation.getRedirectUrl(), transactionId);
    }

    private PaymentInitiationResult resume(String registrationNumber, Payment pending) {
        if (pending.getRedirectUrl() == null) {
            log.info("Payment {} for {} is in progress without a stored session", pending.getTransactionId(),
                    registrationNumber);
            return PaymentInitiationResult.paymentInProgress(registrationNumber, pending.getTransactionId());
        }
        log.info("Resuming gateway session {} for {}", pending.getTransactionId(), registrationNumber);
        return PaymentInitiationResult.redirect(registrationNumber, pending.getRedirectUrl(),
                pending.getTransactionId());
    }

    /**
     * Applies a success callback: the payment must exist, the gateway must confirm it, and the
     * amount must equal the workshop fee. A payment that is already completed is reported as
     * such without contacting the gateway again.
     */
    public CallbackResult handleSuccessCallback(String validationId, String transactionId, String reportedAmount) {
        Optional<Payment> paymentOpt = transactionId == null
                ? Optional.empty()
                : paymentRecordService.findByTransactionId(transactionId);
        if (paymentOpt.isEmpty()) {
            log.warn("Success callback for unknown transaction: {}", transactionId);
            return CallbackResult.notFound();
        }

        Payment payment = paymentOpt.get();
        if (payment.isCompleted()) {
            log.info("Repeated success callback for completed transaction {}", transactionId);
            return CallbackResult.of(CallbackOutcome.ALREADY_COMPLETED, payment);
        }

        GatewayValidation validation = paymentGateway.validate(validationId, transactionId);
        if (!validation.isSuccess()) {
            log.warn("Gateway validation failed for transaction {}: {}", transactionId, validation.getError());
            return paymentRecordService.applyRejectedSuccess(transactionId, CallbackOutcome.VALIDATION_FAILED,
                    validationId, validation.getRawResponse());
        }

        BigDecimal expected = payment.getRegistration().getWorkshop().getFee();
        boolean reportedMatches = paymentGateway.amountsMatch(reportedAmount, expected);
        boolean validatedMatches = validation.getAmount() == null
                || paymentGateway.amountsMatch(validation.getAmount(), expected);
        boolean currencyMatches = validation.getCurrency() == null
                || validation.getCurrency().equalsIgnoreCase(payment.getCurrency());
        if (!reportedMatches || !validatedMatches || !currencyMatches) {
            log.warn("Amount mismatch for transaction {}: reported {} validated {} {} expected {} {}",
                    transactionId, reportedAmount, validation.getAmount(), validation.getCurrency(),
                    expected, payment.getCurrency());
            return paymentRecordService.applyRejectedSuccess(transactionId, CallbackOutcome.AMOUNT_MISMATCH,
                    validationId, validation.getRawResponse());
        }

        CallbackResult result = paymentRecordService.applySuccess(transactionId, validationId,
                validation.getRawResponse());
        if (result.getOutcome() == CallbackOutcome.COMPLETED) {
            Payment completed = result.getPayment();
            notificationService.sendPaymentConfirmation(completed.getRegistration(), completed);
        }
        return result;
    }

    public CallbackResult handleFailCallback(String transactionId) {
        if (transactionId == null) {
            log.warn("Fail callback without transaction id");
            return CallbackResult.notFound();
        }
        return paymentRecordService.applyFailed(transactionId);
    }

    public CallbackResult handleCancelCallback(String transactionId) {
        if (transactionId == null) {
            log.warn("Cancel callback without transaction id");
            return CallbackResult.notFound();
        }
        return paymentRecordService.applyCancelled(transactionId);
    }

    /**
     * TXN-{registration number}-{8 uppercase hex digits}.
     */
    public static String newTransactionId(String registrationNumber) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "TXN-" + registrationNumber + "-" + suffix;
    }

    private boolean hasSeat(Workshop workshop) {
        return workshopService.occupiedSlots(workshop) < workshop.getCapacity();
    }
}
