package com.tsc.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.entity.Registration;
import com.tsc.exception.ResourceNotFoundException;
import com.tsc.payment.entity.Payment;
import com.tsc.payment.repository.PaymentRepository;
import com.tsc.repository.IRegistrationRepository;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class ReceiptService {

    @Autowired
    private IRegistrationRepository registrationRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private ReceiptRenderer receiptRenderer;

    public static String fileName(String registrationNumber) {
        return "receipt_" + registrationNumber + ".pdf";
    }

    /**
     * Receipt for a completed or free registration. Any other registration is reported as
     * not found.
     */
    @Transactional(readOnly = true)
    public byte[] getReceipt(String registrationNumber) {
        Registration registration = registrationRepository.findByRegistrationNumber(registrationNumber)
                .filter(Registration::isReceiptAvailable)
                .orElseThrow(() -> new ResourceNotFoundException("No receipt available for " + registrationNumber));

        Payment payment = paymentRepository.findByRegistrationId(registration.getId()).orElse(null);
        log.info("Rendering receipt for {}", registrationNumber);
        return receiptRenderer.renderReceipt(registration, payment);
    }
}
