package com.tsc.payment.service;

import com.tsc.config.RegistrationProperties;
import com.tsc.config.SslCommerzProperties;
import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.entity.Workshop;
import com.tsc.payment.entity.Payment;
import com.tsc.payment.entity.PaymentStatus;
import com.tsc.payment.gateway.CallbackUrls;
import com.tsc.payment.gateway.GatewayInitiation;
import com.tsc.payment.gateway.GatewayPaymentRequest;
import com.tsc.payment.gateway.GatewayValidation;
import com.tsc.payment.gateway.PaymentGateway;
import com.tsc.repository.IRegistrationRepository;
import com.tsc.service.NotificationService;
import com.tsc.service.WorkshopService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentLifecycleServiceTest {

    private static final String REG_NO = "REG-20260315-AB12C";
    private static final String TRAN_ID = "TXN-REG-20260315-AB12C-0A1B2C3D";

    // Real amountsMatch default methods, stubbed initiate/validate
    @Mock(answer = Answers.CALLS_REAL_METHODS)
    private PaymentGateway mockGateway;

    @Mock
    private PaymentRecordService mockPaymentRecordService;

    @Mock
    private IRegistrationRepository mockRegistrationRepository;

    @Mock
    private WorkshopService mockWorkshopService;

    @Mock
    private NotificationService mockNotificationService;

    private RegistrationProperties registrationProperties;

    private PaymentLifecycleService lifecycleService;

    private Workshop workshop;
    private Registration registration;
    private final CallbackUrls callbackUrls = CallbackUrls.fromBase("https://api.example.test");

    @BeforeEach
    void setUp() {
        registrationProperties = new RegistrationProperties();
        lifecycleService = new PaymentLifecycleService(mockGateway, mockPaymentRecordService,
                mockRegistrationRepository, mockWorkshopService, mockNotificationService,
                registrationProperties, new SslCommerzProperties());

        workshop = Workshop.builder().id(1L).name("Robotics").fee(new BigDecimal("200.00")).capacity(1).build();
        registration = Registration.builder()
                .id(10L)
                .registrationNumber(REG_NO)
                .workshop(workshop)
                .studentName("Ayesha Rahman")
                .grade(8)
                .contactNumber("01712345678")
                .email("ayesha@example.com")
                .paymentStatus(RegistrationStatus.PENDING)
                .build();
    }

    private Payment pendingPayment() {
        return Payment.builder()
                .id(100L)
                .registration(registration)
                .transactionId(TRAN_ID)
                .amount(new BigDecimal("200.00"))
                .status(PaymentStatus.PENDING)
                .redirectUrl("https://sandbox.sslcommerz.com/pay/first")
                .build();
    }

    // ========================================================================
    // initiate()
    // ========================================================================

    @Test
    void initiate_UnknownRegistration_ReturnsNotFound() {
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.empty());

        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        assertThat(result.getStatus()).isEqualTo(PaymentInitiationResult.Status.NOT_FOUND);
        verify(mockGateway, never()).initiate(any());
    }

    @Test
    void initiate_FreeWorkshop_BypassesGateway() {
        workshop.setFee(BigDecimal.ZERO);
        registration.setPaymentStatus(RegistrationStatus.FREE);
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));

        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        assertThat(result.getStatus()).isEqualTo(PaymentInitiationResult.Status.FREE);
        verify(mockGateway, never()).initiate(any());
        verifyNoInteractions(mockPaymentRecordService);
    }

    @Test
    void initiate_AlreadyCompleted_DoesNotCreatePayment() {
        registration.setPaymentStatus(RegistrationStatus.COMPLETED);
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));

        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        assertThat(result.getStatus()).isEqualTo(PaymentInitiationResult.Status.ALREADY_COMPLETED);
        verify(mockGateway, never()).initiate(any());
        verifyNoInteractions(mockPaymentRecordService);
    }

    @Test
    void initiate_GatewaySuccess_RecordsPendingPaymentWithWorkshopFee() {
        // Given
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));
        when(mockGateway.initiate(any(GatewayPaymentRequest.class)))
                .thenReturn(GatewayInitiation.success("https://sandbox.sslcommerz.com/pay/xyz", "{\"status\":\"SUCCESS\"}"));
        when(mockPaymentRecordService.recordInitiatedPayment(eq(10L), anyString(), any(BigDecimal.class),
                anyString(), anyString(), anyString()))
                .thenAnswer(inv -> Payment.builder().transactionId(inv.getArgument(1)).redirectUrl(inv.getArgument(4))
                        .status(PaymentStatus.PENDING).build());

        // When
        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        // Then
        assertThat(result.isRedirect()).isTrue();
        assertThat(result.getRedirectUrl()).isEqualTo("https://sandbox.sslcommerz.com/pay/xyz");
        assertThat(result.getTransactionId()).matches("TXN-" + REG_NO + "-[0-9A-F]{8}");

        ArgumentCaptor<GatewayPaymentRequest> requestCaptor = ArgumentCaptor.forClass(GatewayPaymentRequest.class);
        verify(mockGateway).initiate(requestCaptor.capture());
        GatewayPaymentRequest request = requestCaptor.getValue();
        assertThat(request.getAmount()).isEqualByComparingTo("200.00");
        assertThat(request.getCurrency()).isEqualTo("BDT");
        assertThat(request.getRegistrationNumber()).isEqualTo(REG_NO);
        assertThat(request.getCallbackUrls().getSuccessUrl()).isEqualTo("https://api.example.test/api/payment/success");

        verify(mockPaymentRecordService).recordInitiatedPayment(eq(10L), eq(result.getTransactionId()),
                eq(new BigDecimal("200.00")), eq("BDT"), eq("https://sandbox.sslcommerz.com/pay/xyz"),
                eq("{\"status\":\"SUCCESS\"}"));
    }

    @Test
    void initiate_GatewayFailure_CreatesNoPayment() {
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));
        when(mockPaymentRecordService.findByRegistrationId(10L)).thenReturn(Optional.empty());
        when(mockGateway.initiate(any(GatewayPaymentRequest.class)))
                .thenReturn(GatewayInitiation.failure("Connection error: timed out", null));

        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        assertThat(result.getStatus()).isEqualTo(PaymentInitiationResult.Status.GATEWAY_ERROR);
        assertThat(result.getMessage()).doesNotContain("timed out");
        verify(mockPaymentRecordService, never()).recordInitiatedPayment(any(), any(), any(), any(), any(), any());
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.PENDING);
    }

    @Test
    void initiate_StrictModeWithNoSeatLeft_ReturnsWorkshopFull() {
        registrationProperties.setStrictMode(true);
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));
        when(mockWorkshopService.occupiedSlots(workshop)).thenReturn(1L);
        when(mockPaymentRecordService.findByRegistrationId(10L)).thenReturn(Optional.empty());

        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        assertThat(result.getStatus()).isEqualTo(PaymentInitiationResult.Status.WORKSHOP_FULL);
        verify(mockGateway, never()).initiate(any());
    }

    @Test
    void initiate_PendingPaymentExists_ResumesSessionWithoutGateway() {
        // Given
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));
        when(mockPaymentRecordService.findByRegistrationId(10L)).thenReturn(Optional.of(pendingPayment()));

        // When
        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        // Then
        assertThat(result.isRedirect()).isTrue();
        assertThat(result.getTransactionId()).isEqualTo(TRAN_ID);
        assertThat(result.getRedirectUrl()).isEqualTo("https://sandbox.sslcommerz.com/pay/first");
        verify(mockGateway, never()).initiate(any());
        verify(mockPaymentRecordService, never()).recordInitiatedPayment(any(), any(), any(), any(), any(), any());
    }

    @Test
    void initiate_PendingPaymentWithoutSession_ReturnsInProgress() {
        Payment pending = pendingPayment();
        pending.setRedirectUrl(null);
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));
        when(mockPaymentRecordService.findByRegistrationId(10L)).thenReturn(Optional.of(pending));

        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        assertThat(result.getStatus()).isEqualTo(PaymentInitiationResult.Status.PAYMENT_IN_PROGRESS);
        assertThat(result.getTransactionId()).isEqualTo(TRAN_ID);
        verify(mockGateway, never()).initiate(any());
    }

    @Test
    void initiate_ConcurrentSessionRecordedFirst_RedirectsToKeptSession() {
        // Given - another request stored its session between the lookup and the insert
        when(mockRegistrationRepository.findByRegistrationNumber(REG_NO)).thenReturn(Optional.of(registration));
        when(mockPaymentRecordService.findByRegistrationId(10L)).thenReturn(Optional.empty());
        when(mockGateway.initiate(any(GatewayPaymentRequest.class)))
                .thenReturn(GatewayInitiation.success("https://sandbox.sslcommerz.com/pay/second", "{}"));
        when(mockPaymentRecordService.recordInitiatedPayment(eq(10L), anyString(), any(BigDecimal.class),
                anyString(), anyString(), anyString()))
                .thenReturn(pendingPayment());

        // When
        PaymentInitiationResult result = lifecycleService.initiate(REG_NO, callbackUrls);

        // Then
        assertThat(result.isRedirect()).isTrue();
        assertThat(result.getTransactionId()).isEqualTo(TRAN_ID);
        assertThat(result.getRedirectUrl()).isEqualTo("https://sandbox.sslcommerz.com/pay/first");
    }

    // ========================================================================
    // handleSuccessCallback()
    // ========================================================================

    @Test
    void successCallback_UnknownTransaction_ReturnsNotFoundWithoutValidation() {
        when(mockPaymentRecordService.findByTransactionId("TXN-UNKNOWN")).thenReturn(Optional.empty());

        CallbackResult result = lifecycleService.handleSuccessCallback("VAL1", "TXN-UNKNOWN", "200.00");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.PAYMENT_NOT_FOUND);
        verify(mockGateway, never()).validate(anyString(), anyString());
        verifyNoInteractions(mockNotificationService);
    }

    @Test
    void successCallback_ValidationFails_MarksPaymentFailed() {
        when(mockPaymentRecordService.findByTransactionId(TRAN_ID)).thenReturn(Optional.of(pendingPayment()));
        when(mockGateway.validate("VAL1", TRAN_ID)).thenReturn(GatewayValidation.invalid("Payment validation failed", "{}"));
        when(mockPaymentRecordService.applyRejectedSuccess(TRAN_ID, CallbackOutcome.VALIDATION_FAILED, "VAL1", "{}"))
                .thenReturn(CallbackResult.of(CallbackOutcome.VALIDATION_FAILED, pendingPayment()));

        CallbackResult result = lifecycleService.handleSuccessCallback("VAL1", TRAN_ID, "200.00");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.VALIDATION_FAILED);
        verify(mockPaymentRecordService, never()).applySuccess(anyString(), anyString(), anyString());
        verifyNoInteractions(mockNotificationService);
    }

    @Test
    void successCallback_ReportedAmountDiffersFromFee_MarksPaymentFailed() {
        when(mockPaymentRecordService.findByTransactionId(TRAN_ID)).thenReturn(Optional.of(pendingPayment()));
        when(mockGateway.validate("VAL1", TRAN_ID))
                .thenReturn(GatewayValidation.valid(TRAN_ID, new BigDecimal("150.00"), "BDT", "{}"));
        when(mockPaymentRecordService.applyRejectedSuccess(TRAN_ID, CallbackOutcome.AMOUNT_MISMATCH, "VAL1", "{}"))
                .thenReturn(CallbackResult.of(CallbackOutcome.AMOUNT_MISMATCH, pendingPayment()));

        CallbackResult result = lifecycleService.handleSuccessCallback("VAL1", TRAN_ID, "150.00");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.AMOUNT_MISMATCH);
        verify(mockPaymentRecordService, never()).applySuccess(anyString(), anyString(), anyString());
        verifyNoInteractions(mockNotificationService);
    }

    @Test
    void successCallback_ValidatedAmountDiffersFromFee_MarksPaymentFailed() {
        // The form amount matches but the gateway's own record does not
        when(mockPaymentRecordService.findByTransactionId(TRAN_ID)).thenReturn(Optional.of(pendingPayment()));
        when(mockGateway.validate("VAL1", TRAN_ID))
                .thenReturn(GatewayValidation.valid(TRAN_ID, new BigDecimal("20.00"), "BDT", "{}"));
        when(mockPaymentRecordService.applyRejectedSuccess(TRAN_ID, CallbackOutcome.AMOUNT_MISMATCH, "VAL1", "{}"))
                .thenReturn(CallbackResult.of(CallbackOutcome.AMOUNT_MISMATCH, pendingPayment()));

        CallbackResult result = lifecycleService.handleSuccessCallback("VAL1", TRAN_ID, "200.00");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.AMOUNT_MISMATCH);
    }

    @Test
    void successCallback_MatchingAmountWithDifferentScale_CompletesAndNotifiesOnce() {
        // Given
        Payment payment = pendingPayment();
        when(mockPaymentRecordService.findByTransactionId(TRAN_ID)).thenReturn(Optional.of(payment));
        when(mockGateway.validate("VAL1", TRAN_ID))
                .thenReturn(GatewayValidation.valid(TRAN_ID, new BigDecimal("200.0"), "BDT", "{\"status\":\"VALID\"}"));
        when(mockPaymentRecordService.applySuccess(TRAN_ID, "VAL1", "{\"status\":\"VALID\"}"))
                .thenAnswer(inv -> {
                    payment.markCompleted(LocalDateTime.of(2026, 3, 15, 10, 5));
                    return CallbackResult.of(CallbackOutcome.COMPLETED, payment);
                });

        // When
        CallbackResult result = lifecycleService.handleSuccessCallback("VAL1", TRAN_ID, "200");

        // Then
        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.COMPLETED);
        assertThat(result.getRegistrationNumber()).isEqualTo(REG_NO);
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.COMPLETED);
        verify(mockNotificationService, times(1)).sendPaymentConfirmation(registration, payment);
    }

    @Test
    void successCallback_AlreadyCompleted_IsNoOpSuccess() {
        // Given
        Payment payment = pendingPayment();
        LocalDateTime completedAt = LocalDateTime.of(2026, 3, 15, 10, 5);
        payment.markCompleted(completedAt);
        when(mockPaymentRecordService.findByTransactionId(TRAN_ID)).thenReturn(Optional.of(payment));

        // When
        CallbackResult first = lifecycleService.handleSuccessCallback("VAL1", TRAN_ID, "200.00");
        CallbackResult second = lifecycleService.handleSuccessCallback("VAL1", TRAN_ID, "200.00");

        // Then
        assertThat(first.getOutcome()).isEqualTo(CallbackOutcome.ALREADY_COMPLETED);
        assertThat(second.getOutcome()).isEqualTo(CallbackOutcome.ALREADY_COMPLETED);
        assertThat(first.getOutcome().isSuccess()).isTrue();
        assertThat(payment.getCompletedAt()).isEqualTo(completedAt);
        verify(mockGateway, never()).validate(anyString(), anyString());
        verify(mockPaymentRecordService, never()).applySuccess(anyString(), anyString(), anyString());
        verifyNoInteractions(mockNotificationService);
    }

    @Test
    void successCallback_LostRaceToConcurrentDelivery_DoesNotNotifyAgain() {
        // Given - another delivery completed the payment between lookup and commit
        Payment payment = pendingPayment();
        when(mockPaymentRecordService.findByTransactionId(TRAN_ID)).thenReturn(Optional.of(payment));
        when(mockGateway.validate("VAL1", TRAN_ID))
                .thenReturn(GatewayValidation.valid(TRAN_ID, new BigDecimal("200.00"), "BDT", "{}"));
        when(mockPaymentRecordService.applySuccess(TRAN_ID, "VAL1", "{}"))
                .thenReturn(CallbackResult.of(CallbackOutcome.ALREADY_COMPLETED, payment));

        // When
        CallbackResult result = lifecycleService.handleSuccessCallback("VAL1", TRAN_ID, "200.00");

        // Then
        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.ALREADY_COMPLETED);
        verifyNoInteractions(mockNotificationService);
    }

    // ========================================================================
    // handleFailCallback() / handleCancelCallback()
    // ========================================================================

    @Test
    void cancelCallback_UnknownTransaction_ReportsNotFound() {
        when(mockPaymentRecordService.applyCancelled("TXN-UNKNOWN")).thenReturn(CallbackResult.notFound());

        CallbackResult result = lifecycleService.handleCancelCallback("TXN-UNKNOWN");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.PAYMENT_NOT_FOUND);
        assertThat(result.getRegistrationNumber()).isNull();
    }

    @Test
    void failCallback_WithoutTransactionId_ReportsNotFound() {
        CallbackResult result = lifecycleService.handleFailCallback(null);

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.PAYMENT_NOT_FOUND);
        verifyNoInteractions(mockPaymentRecordService);
    }

    @Test
    void newTransactionId_EmbedsRegistrationNumber() {
        assertThat(PaymentLifecycleService.newTransactionId(REG_NO))
                .matches("TXN-REG-20260315-AB12C-[0-9A-F]{8}");
    }
}
