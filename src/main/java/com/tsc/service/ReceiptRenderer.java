package com.tsc.service;

import com.tsc.entity.Registration;
import com.tsc.payment.entity.Payment;

public interface ReceiptRenderer {

    /**
     * Renders a PDF receipt.
     *
     * @param registration a completed or free registration
     * @param payment its gateway payment, or null for free registrations
     */
    byte[] renderReceipt(Registration registration, Payment payment);
}
