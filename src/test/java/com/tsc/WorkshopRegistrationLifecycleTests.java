package com.tsc;

import com.tsc.dto.RegistrationRequestDTO;
import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.entity.School;
import com.tsc.entity.Workshop;
import com.tsc.payment.entity.Payment;
import com.tsc.payment.entity.PaymentStatus;
import com.tsc.payment.gateway.CallbackUrls;
import com.tsc.payment.gateway.GatewayInitiation;
import com.tsc.payment.gateway.GatewayPaymentRequest;
import com.tsc.payment.gateway.GatewayValidation;
import com.tsc.payment.gateway.PaymentGateway;
import com.tsc.payment.repository.PaymentRepository;
import com.tsc.payment.service.CallbackOutcome;
import com.tsc.payment.service.CallbackResult;
import com.tsc.payment.service.PaymentInitiationResult;
import com.tsc.payment.service.PaymentLifecycleService;
import com.tsc.repository.IRegistrationRepository;
import com.tsc.repository.ISchoolRepository;
import com.tsc.repository.IWorkshopRepository;
import com.tsc.service.NotificationService;
import com.tsc.service.ReceiptService;
import com.tsc.service.RegistrationError;
import com.tsc.service.RegistrationResult;
import com.tsc.service.RegistrationService;
import com.tsc.service.WorkshopService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Registration through payment against the real persistence layer. Only the gateway and the
 * mail sender are replaced.
 */
@SpringBootTest
@Transactional
class WorkshopRegistrationLifecycleTests {

    private static final CallbackUrls CALLBACKS = CallbackUrls.fromBase("http://localhost:8080");

    @Autowired RegistrationService registrationService;
    @Autowired PaymentLifecycleService paymentLifecycleService;
    @Autowired WorkshopService workshopService;
    @Autowired ReceiptService receiptService;
    @Autowired IWorkshopRepository workshopRepository;
    @Autowired ISchoolRepository schoolRepository;
    @Autowired IRegistrationRepository registrationRepository;
    @Autowired PaymentRepository paymentRepository;

    @MockBean(answer = Answers.CALLS_REAL_METHODS) PaymentGateway paymentGateway;
    @MockBean NotificationService notificationService;

    private School school;
    private Workshop paidWorkshop;

    @BeforeEach
    void setup() {
        school = schoolRepository.save(new School("Sunbeams School"));
        paidWorkshop = workshopRepository.save(Workshop.builder()
                .name("Robotics")
                .workshopDate("2026-04-02")
                .venue("Main Hall")
                .fee(new BigDecimal("200.00"))
                .capacity(1)
                .build());

        doReturn("sslcommerz").when(paymentGateway).providerId();
        doReturn(GatewayInitiation.success("https://gateway.test/pay", "{\"status\":\"SUCCESS\"}"))
                .when(paymentGateway).initiate(any(GatewayPaymentRequest.class));
        doAnswer(inv -> GatewayValidation.valid(inv.getArgument(1), new BigDecimal("200.00"), "BDT", "{\"status\":\"VALID\"}"))
                .when(paymentGateway).validate(anyString(), anyString());
    }

    private RegistrationRequestDTO form(String name, String email) {
        RegistrationRequestDTO dto = new RegistrationRequestDTO();
        dto.setStudentName(name);
        dto.setGrade("8");
        dto.setSchoolId(school.getId());
        dto.setContactNumber("01712345678");
        dto.setEmail(email);
        dto.setTermsAgreed(true);
        return dto;
    }

    private Registration register(Workshop workshop, String name, String email) {
        RegistrationResult result = registrationService.submit(workshop.getId(), form(name, email));
        assertThat(result.isSuccess()).as(String.valueOf(result.getMessage())).isTrue();
        return result.getRegistration();
    }

    private String startPayment(Registration registration) {
        PaymentInitiationResult result = paymentLifecycleService.initiate(registration.getRegistrationNumber(), CALLBACKS);
        assertThat(result.isRedirect()).isTrue();
        return result.getTransactionId();
    }

    // --- free workshops ---

    @Test
    void freeWorkshop_registrationIsConfirmedAndReceiptIsRendered() {
        Workshop freeWorkshop = workshopRepository.save(Workshop.builder()
                .name("Science Fair Prep")
                .fee(BigDecimal.ZERO)
                .capacity(50)
                .build());

        Registration registration = register(freeWorkshop, "Ayesha Rahman", "Ayesha@Example.com");

        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.FREE);
        assertThat(registration.getRegistrationNumber()).matches(RegistrationService.REGISTRATION_NUMBER_PATTERN);
        assertThat(registration.getEmail()).isEqualTo("ayesha@example.com");
        assertThat(workshopService.currentRegistrations(freeWorkshop)).isEqualTo(1);

        byte[] pdf = receiptService.getReceipt(registration.getRegistrationNumber());
        assertThat(new String(pdf, 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");

        PaymentInitiationResult payment = paymentLifecycleService.initiate(registration.getRegistrationNumber(), CALLBACKS);
        assertThat(payment.getStatus()).isEqualTo(PaymentInitiationResult.Status.FREE);
        verify(paymentGateway, never()).initiate(any());
        verify(notificationService).sendConfirmation(registration);
    }

    @Test
    void registrationNumbers_areUniquePerRegistration() {
        Workshop freeWorkshop = workshopRepository.save(Workshop.builder().name("Chess").fee(BigDecimal.ZERO).capacity(10).build());

        Registration first = register(freeWorkshop, "Student One", "one@example.com");
        Registration second = register(freeWorkshop, "Student Two", "two@example.com");

        assertThat(first.getRegistrationNumber()).isNotEqualTo(second.getRegistrationNumber());
        assertThat(registrationRepository.existsByRegistrationNumber(first.getRegistrationNumber())).isTrue();
    }

    @Test
    void sameEmailTwice_isRejectedRegardlessOfCase() {
        register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");

        RegistrationResult second = registrationService.submit(paidWorkshop.getId(), form("Ayesha R.", "AYESHA@example.com"));

        assertThat(second.isSuccess()).isFalse();
        assertThat(second.getError()).isEqualTo(RegistrationError.DUPLICATE_REGISTRATION);
        assertThat(registrationRepository.countByWorkshopId(paidWorkshop.getId())).isEqualTo(1);
    }

    // --- capacity ---

    @Test
    void pendingRegistrations_doNotHoldSeats_untilPaymentCompletes() {
        Registration first = register(paidWorkshop, "Student One", "one@example.com");
        Registration second = register(paidWorkshop, "Student Two", "two@example.com");
        assertThat(first.getPaymentStatus()).isEqualTo(RegistrationStatus.PENDING);
        assertThat(second.getPaymentStatus()).isEqualTo(RegistrationStatus.PENDING);

        String firstTransaction = startPayment(first);
        startPayment(second);
        assertThat(workshopService.isFull(paidWorkshop)).isFalse();

        CallbackResult completed = paymentLifecycleService.handleSuccessCallback("VAL-1", firstTransaction, "200.00");
        assertThat(completed.getOutcome()).isEqualTo(CallbackOutcome.COMPLETED);

        assertThat(workshopService.isFull(paidWorkshop)).isTrue();
        assertThat(workshopService.availableSlots(paidWorkshop)).isZero();
        RegistrationResult third = registrationService.submit(paidWorkshop.getId(), form("Student Three", "three@example.com"));
        assertThat(third.getError()).isEqualTo(RegistrationError.WORKSHOP_FULL);
        assertThat(registrationRepository.findByRegistrationNumber(second.getRegistrationNumber()))
                .get()
                .extracting(Registration::getPaymentStatus)
                .isEqualTo(RegistrationStatus.PENDING);
    }

    // --- payment lifecycle ---

    @Test
    void successfulPayment_completesBothRowsAndNotifiesOnce() {
        Registration registration = register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");
        String transactionId = startPayment(registration);

        Payment pending = paymentRepository.findByTransactionId(transactionId).orElseThrow();
        assertThat(pending.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(pending.getAmount()).isEqualByComparingTo("200.00");
        assertThat(pending.getCompletedAt()).isNull();

        CallbackResult result = paymentLifecycleService.handleSuccessCallback("VAL-1", transactionId, "200.00");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.COMPLETED);
        assertThat(result.getRegistrationNumber()).isEqualTo(registration.getRegistrationNumber());
        Payment completed = paymentRepository.findByRegistrationId(registration.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(completed.getValidationId()).isEqualTo("VAL-1");
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.COMPLETED);
        assertThat(registration.isReceiptAvailable()).isTrue();
        assertThat(paymentRepository.count()).isEqualTo(1);
        verify(notificationService, times(1)).sendPaymentConfirmation(any(Registration.class), any(Payment.class));
    }

    @Test
    void repeatedSuccessCallback_leavesCompletedPaymentUntouched() {
        Registration registration = register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");
        String transactionId = startPayment(registration);
        paymentLifecycleService.handleSuccessCallback("VAL-1", transactionId, "200.00");
        LocalDateTime completedAt = paymentRepository.findByTransactionId(transactionId).orElseThrow().getCompletedAt();

        CallbackResult repeated = paymentLifecycleService.handleSuccessCallback("VAL-1", transactionId, "200.00");

        assertThat(repeated.getOutcome()).isEqualTo(CallbackOutcome.ALREADY_COMPLETED);
        assertThat(paymentRepository.findByTransactionId(transactionId).orElseThrow().getCompletedAt()).isEqualTo(completedAt);
        verify(paymentGateway, times(1)).validate(anyString(), anyString());
        verify(notificationService, times(1)).sendPaymentConfirmation(any(Registration.class), any(Payment.class));
    }

    @Test
    void tamperedAmount_failsPayment() {
        Registration registration = register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");
        String transactionId = startPayment(registration);

        CallbackResult result = paymentLifecycleService.handleSuccessCallback("VAL-1", transactionId, "150.00");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.AMOUNT_MISMATCH);
        Payment payment = paymentRepository.findByTransactionId(transactionId).orElseThrow();
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(payment.getCompletedAt()).isNull();
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.FAILED);
        verify(notificationService, never()).sendPaymentConfirmation(any(), any());
    }

    @Test
    void retryAfterCancel_replacesPaymentWithNewTransaction() {
        Registration registration = register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");
        String firstTransaction = startPayment(registration);
        CallbackResult cancelled = paymentLifecycleService.handleCancelCallback(firstTransaction);
        assertThat(cancelled.getOutcome()).isEqualTo(CallbackOutcome.CANCELLED);
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.CANCELLED);

        String secondTransaction = startPayment(registration);

        assertThat(secondTransaction).isNotEqualTo(firstTransaction);
        assertThat(paymentRepository.findByTransactionId(firstTransaction)).isEmpty();
        assertThat(paymentRepository.findByRegistrationId(registration.getId()))
                .get()
                .extracting(Payment::getStatus)
                .isEqualTo(PaymentStatus.PENDING);
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.PENDING);
        assertThat(paymentRepository.count()).isEqualTo(1);
    }

    @Test
    void secondCheckoutWhilePending_resumesFirstSessionSoItsPaymentCompletes() {
        Registration registration = register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");
        String firstTransaction = startPayment(registration);

        PaymentInitiationResult again = paymentLifecycleService.initiate(registration.getRegistrationNumber(), CALLBACKS);

        assertThat(again.isRedirect()).isTrue();
        assertThat(again.getTransactionId()).isEqualTo(firstTransaction);
        assertThat(again.getRedirectUrl()).isEqualTo("https://gateway.test/pay");
        verify(paymentGateway, times(1)).initiate(any(GatewayPaymentRequest.class));

        CallbackResult result = paymentLifecycleService.handleSuccessCallback("VAL-1", firstTransaction, "200.00");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.COMPLETED);
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.COMPLETED);
        assertThat(paymentRepository.count()).isEqualTo(1);
    }

    @Test
    void cancelForUnknownTransaction_changesNothing() {
        Registration registration = register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");
        String transactionId = startPayment(registration);

        CallbackResult result = paymentLifecycleService.handleCancelCallback("TXN-DOES-NOT-EXIST");

        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.PAYMENT_NOT_FOUND);
        assertThat(result.getRegistrationNumber()).isNull();
        assertThat(paymentRepository.findByTransactionId(transactionId).orElseThrow().getStatus())
                .isEqualTo(PaymentStatus.PENDING);
        assertThat(registration.getPaymentStatus()).isEqualTo(RegistrationStatus.PENDING);
    }

    // --- database constraints ---

    @Test
    void duplicateEmailForSameWorkshop_isRejectedByDatabase() {
        Registration first = register(paidWorkshop, "Ayesha Rahman", "ayesha@example.com");

        Registration copy = Registration.builder()
                .registrationNumber("REG-20260101-DUP01")
                .workshop(paidWorkshop)
                .studentName("Ayesha Copy")
                .grade(8)
                .school(school)
                .contactNumber("01712345678")
                .email(first.getEmail())
                .paymentStatus(RegistrationStatus.PENDING)
                .build();

        assertThatThrownBy(() -> registrationRepository.saveAndFlush(copy))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void duplicateTransactionId_isRejectedByDatabase() {
        Registration first = register(paidWorkshop, "Student One", "one@example.com");
        Registration second = register(paidWorkshop, "Student Two", "two@example.com");
        String transactionId = startPayment(first);

        Payment copy = Payment.builder()
                .registration(second)
                .transactionId(transactionId)
                .amount(new BigDecimal("200.00"))
                .status(PaymentStatus.PENDING)
                .initiatedAt(LocalDateTime.now())
                .build();

        assertThatThrownBy(() -> paymentRepository.saveAndFlush(copy))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
