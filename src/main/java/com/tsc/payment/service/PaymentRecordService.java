package com.tsc.payment.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.config.RegistrationProperties;
import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.payment.entity.Payment;
import com.tsc.payment.entity.PaymentMethod;
import com.tsc.payment.entity.PaymentStatus;
import com.tsc.payment.repository.PaymentRepository;
import com.tsc.repository.IRegistrationRepository;

/**
 * Persists payment state transitions. Each public method is one transaction that updates the
 * payment and its registration together; callback transitions run under a row lock on the
 * payment so concurrent deliveries for one transaction are applied in sequence.
 */
@Service
@Transactional
public class PaymentRecordService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentRecordService.class);

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private IRegistrationRepository registrationRepository;

    @Autowired
    private RegistrationProperties registrationProperties;

    @Autowired
    private Clock clock;

    /**
     * Stores a freshly opened gateway session. A failed or cancelled attempt for the same
     * registration is replaced and the registration goes back to pending. A pending attempt
     * is kept and returned unchanged.
     */
    public Payment recordInitiatedPayment(Long registrationId, String transactionId, BigDecimal amount,
                                          String currency, String redirectUrl, String gatewayResponse) {
        Registration registration = registrationRepository.findById(registrationId)
                .orElseThrow(() -> new IllegalArgumentException("Registration not found: " + registrationId));

        Optional<Payment> previous = paymentRepository.findByRegistrationId(registrationId);
        if (previous.isPresent()) {
            Payment old = previous.get();
            if (old.isCompleted()) {
                throw new IllegalStateException("Registration " + registration.getRegistrationNumber()
                        + " already has a completed payment");
            }
            if (old.getStatus() == PaymentStatus.PENDING) {
                logger.warn("Keeping pending payment {} for registration {}, discarding {}",
                        old.getTransactionId(), registration.getRegistrationNumber(), transactionId);
                return old;
            }
            logger.info("Replacing {} payment {} for registration {}",
                    old.getStatus(), old.getTransactionId(), registration.getRegistrationNumber());
            paymentRepository.delete(old);
            // The new row reuses the unique registration_id
            paymentRepository.flush();
        }

        Payment payment = Payment.builder()
                .registration(registration)
                .transactionId(transactionId)
                .amount(amount)
                .currency(currency)
                .status(PaymentStatus.PENDING)
                .paymentMethod(PaymentMethod.GATEWAY)
                .redirectUrl(redirectUrl)
                .gatewayResponse(gatewayResponse)
                .initiatedAt(LocalDateTime.now(clock))
                .build();
        registration.setPaymentStatus(RegistrationStatus.fromPaymentStatus(PaymentStatus.PENDING));

        Payment saved = paymentRepository.save(payment);
        logger.info("Created payment {} for registration {} amount: {} {}",
                transactionId, registration.getRegistrationNumber(), amount, currency);
        return saved;
    }

    /**
     * Commits a validated success callback. A payment that is already completed is left as it is.
     */
    public CallbackResult applySuccess(String transactionId, String validationId, String gatewayResponse) {
        Optional<Payment> paymentOpt = paymentRepository.findForUpdateByTransactionId(transactionId);
        if (paymentOpt.isEmpty()) {
            logger.warn("Success callback for unknown transaction: {}", transactionId);
            return CallbackResult.notFound();
        }

        Payment payment = paymentOpt.get();
        if (payment.isCompleted()) {
            logger.info("Payment {} already completed at {}, ignoring repeated success callback",
                    transactionId, payment.getCompletedAt());
            return CallbackResult.of(CallbackOutcome.ALREADY_COMPLETED, payment);
        }

        payment.setValidationId(validationId);
        payment.setGatewayResponse(gatewayResponse);
        payment.markCompleted(LocalDateTime.now(clock));
        paymentRepository.save(payment);

        logger.info("Payment {} completed for registration {}",
                transactionId, payment.getRegistration().getRegistrationNumber());
        return CallbackResult.of(CallbackOutcome.COMPLETED, payment);
    }

    /**
     * Fails a payment whose success callback could not be confirmed. Never downgrades a
     * completed payment.
     */
    public CallbackResult applyRejectedSuccess(String transactionId, CallbackOutcome reason,
                                               String validationId, String gatewayResponse) {
        Optional<Payment> paymentOpt = paymentRepository.findForUpdateByTransactionId(transactionId);
        if (paymentOpt.isEmpty()) {
            logger.warn("Rejected success callback for unknown transaction: {}", transactionId);
            return CallbackResult.notFound();
        }

        Payment payment = paymentOpt.get();
        if (payment.isCompleted()) {
            logger.info("Payment {} already completed, keeping it despite rejected callback ({})", transactionId, reason);
            return CallbackResult.of(CallbackOutcome.ALREADY_COMPLETED, payment);
        }

        payment.setValidationId(validationId);
        if (gatewayResponse != null) {
            payment.setGatewayResponse(gatewayResponse);
        }
        payment.markFailed();
        paymentRepository.save(payment);

        logger.warn("Payment {} marked failed: {}", transactionId, reason);
        return CallbackResult.of(reason, payment);
    }

    public CallbackResult applyFailed(String transactionId) {
        return applyTerminal(transactionId, PaymentStatus.FAILED);
    }

    public CallbackResult applyCancelled(String transactionId) {
        return applyTerminal(transactionId, PaymentStatus.CANCELLED);
    }

    private CallbackResult applyTerminal(String transactionId, PaymentStatus target) {
        Optional<Payment> paymentOpt = paymentRepository.findForUpdateByTransactionId(transactionId);
        if (paymentOpt.isEmpty()) {
            logger.warn("{} callback for unknown transaction: {}", target, transactionId);
            return CallbackResult.notFound();
        }

        Payment payment = paymentOpt.get();
        if (registrationProperties.isStrictMode() && payment.getStatus().isTerminal()) {
            logger.info("Ignoring {} callback for payment {} already {}", target, transactionId, payment.getStatus());
            return CallbackResult.of(CallbackOutcome.IGNORED, payment);
        }

        if (target == PaymentStatus.FAILED) {
            payment.markFailed();
        } else {
            payment.markCancelled();
        }
        paymentRepository.save(payment);

        logger.info("Payment {} marked {} for registration {}",
                transactionId, target, payment.getRegistration().getRegistrationNumber());
        return CallbackResult.of(target == PaymentStatus.FAILED ? CallbackOutcome.FAILED : CallbackOutcome.CANCELLED,
                payment);
    }

    /**
     * Administrative override: completes the registration without gateway validation and
     * syncs its payment row when one exists.
     *
     * @return false when the registration is free or already completed
     */
    public boolean overrideCompleted(Registration registration) {
        if (registration.getPaymentStatus() == RegistrationStatus.FREE
                || registration.getPaymentStatus() == RegistrationStatus.COMPLETED) {
            return false;
        }

        Optional<Payment> paymentOpt = paymentRepository.findByRegistrationId(registration.getId());
        if (paymentOpt.isPresent()) {
            Payment payment = paymentOpt.get();
            payment.markCompleted(LocalDateTime.now(clock));
            paymentRepository.save(payment);
        } else {
            registration.setPaymentStatus(RegistrationStatus.COMPLETED);
        }
        registrationRepository.save(registration);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByTransactionId(String transactionId) {
        return paymentRepository.findByTransactionId(transactionId);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByRegistrationId(Long registrationId) {
        return paymentRepository.findByRegistrationId(registrationId);
    }

    @Transactional(readOnly = true)
    public List<Payment> findAll() {
        return paymentRepository.findAllByOrderByInitiatedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<Payment> findByStatus(PaymentStatus status) {
        return paymentRepository.findByStatusOrderByInitiatedAtDesc(status);
    }

    /**
     * Get payment statistics
     */
    @Transactional(readOnly = true)
    public PaymentStatistics getPaymentStatistics() {
        long totalRecords = paymentRepository.count();
        long completedPayments = paymentRepository.countByStatus(PaymentStatus.COMPLETED);
        long pendingPayments = paymentRepository.countByStatus(PaymentStatus.PENDING);
        long failedPayments = paymentRepository.countByStatus(PaymentStatus.FAILED);
        long cancelledPayments = paymentRepository.countByStatus(PaymentStatus.CANCELLED);

        BigDecimal revenue = paymentRepository.sumAmountByStatus(PaymentStatus.COMPLETED);

        return new PaymentStatistics(totalRecords, completedPayments, pendingPayments,
                failedPayments, cancelledPayments, revenue);
    }

    public static class PaymentStatistics {
        private final long totalRecords;
        private final long completedPayments;
        private final long pendingPayments;
        private final long failedPayments;
        private final long cancelledPayments;
        private final BigDecimal revenue;

        public PaymentStatistics(long totalRecords, long completedPayments, long pendingPayments,
                                 long failedPayments, long cancelledPayments, BigDecimal revenue) {
            this.totalRecords = totalRecords;
            this.completedPayments = completedPayments;
            this.pendingPayments = pendingPayments;
            this.failedPayments = failedPayments;
            this.cancelledPayments = cancelledPayments;
            this.revenue = revenue != null ? revenue : BigDecimal.ZERO;
        }

        public long getTotalRecords() { return totalRecords; }
        public long getCompletedPayments() { return completedPayments; }
        public long getPendingPayments() { return pendingPayments; }
        public long getFailedPayments() { return failedPayments; }
        public long getCancelledPayments() { return cancelledPayments; }
        public BigDecimal getRevenue() { return revenue; }
    }
}
