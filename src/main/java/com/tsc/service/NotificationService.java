package com.tsc.service;

import com.tsc.entity.Registration;
import com.tsc.payment.entity.Payment;

/**
 * Outbound student notifications. Implementations log and swallow delivery failures and report
 * them through the return value only.
 */
public interface NotificationService {

    boolean sendConfirmation(Registration registration);

    boolean sendPaymentConfirmation(Registration registration, Payment payment);
}
