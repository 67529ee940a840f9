package com.tsc.service;

import java.time.format.DateTimeFormatter;

import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import com.tsc.config.RegistrationProperties;
import com.tsc.entity.Registration;
import com.tsc.entity.Workshop;
import com.tsc.payment.entity.Payment;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class EmailService implements NotificationService {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JavaMailSender mailSender;
    private final RegistrationProperties registrationProperties;

    public EmailService(JavaMailSender mailSender, RegistrationProperties registrationProperties) {
        this.mailSender = mailSender;
        this.registrationProperties = registrationProperties;
    }

    @Override
    public boolean sendConfirmation(Registration registration) {
        Workshop workshop = registration.getWorkshop();
        String fee = workshop.isFree() ? "FREE" : "BDT " + workshop.getFee().toPlainString();

        String body = "Dear " + registration.getStudentName() + ",\n\n" +
                "Your registration for the workshop \"" + workshop.getName() + "\" has been received.\n\n" +
                "Registration Details:\n" +
                "- Registration Number: " + registration.getRegistrationNumber() + "\n" +
                "- Workshop: " + workshop.getName() + "\n" +
                "- Date: " + nullToEmpty(workshop.getWorkshopDate()) + "\n" +
                "- Time: " + nullToEmpty(workshop.getTime()) + "\n" +
                "- Venue: " + nullToEmpty(workshop.getVenue()) + "\n" +
                "- Fee: " + fee + "\n\n" +
                "Student Information:\n" +
                "- Name: " + registration.getStudentName() + "\n" +
                "- Grade: " + registration.getGrade() + "\n" +
                "- School: " + registration.getSchoolDisplayName() + "\n" +
                "- Contact: " + registration.getContactNumber() + "\n" +
                "- Email: " + registration.getEmail() + "\n\n" +
                (workshop.isFree() ? "" : "Your seat is confirmed once the payment is completed.\n\n") +
                "Please save your registration number for future reference.\n\n" +
                "Best regards,\n" + registrationProperties.getOrganizationName();

        return send(registration.getEmail(), "Workshop Registration Confirmed - " + workshop.getName(), body);
    }

    @Override
    public boolean sendPaymentConfirmation(Registration registration, Payment payment) {
        Workshop workshop = registration.getWorkshop();
        String completedAt = payment.getCompletedAt() != null ? payment.getCompletedAt().format(TIMESTAMP) : "N/A";

        String body = "Dear " + registration.getStudentName() + ",\n\n" +
                "Your payment for the workshop \"" + workshop.getName() + "\" has been successfully processed!\n\n" +
                "Payment Details:\n" +
                "- Transaction ID: " + payment.getTransactionId() + "\n" +
                "- Amount: " + payment.getCurrency() + " " + payment.getAmount().toPlainString() + "\n" +
                "- Status: Completed\n" +
                "- Date: " + completedAt + "\n\n" +
                "Registration Details:\n" +
                "- Registration Number: " + registration.getRegistrationNumber() + "\n" +
                "- Workshop: " + workshop.getName() + "\n" +
                "- Date: " + nullToEmpty(workshop.getWorkshopDate()) + "\n" +
                "- Time: " + nullToEmpty(workshop.getTime()) + "\n" +
                "- Venue: " + nullToEmpty(workshop.getVenue()) + "\n\n" +
                "You can download your receipt using your registration number.\n\n" +
                "Best regards,\n" + registrationProperties.getOrganizationName();

        return send(registration.getEmail(), "Payment Confirmed - " + workshop.getName(), body);
    }

    private boolean send(String to, String subject, String text) {
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(registrationProperties.getMailFrom());
            message.setTo(to);
            message.setSubject(subject);
            message.setText(text);

            mailSender.send(message);
            log.info("Email '{}' sent to {}", subject, to);
            return true;
        } catch (MailException e) {
            log.error("Error sending email '{}' to {}: {}", subject, to, e.getMessage(), e);
            return false;
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
