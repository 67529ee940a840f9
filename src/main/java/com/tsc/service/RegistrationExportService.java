package com.tsc.service;

import java.util.List;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.repository.IRegistrationRepository;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class RegistrationExportService {

    static final List<ExportColumn<Registration>> COLUMNS = List.of(
            column("Registration Number", Registration::getRegistrationNumber),
            column("Workshop", r -> r.getWorkshop().getName()),
            column("Workshop Date", r -> r.getWorkshop().getWorkshopDate()),
            column("Student Name", Registration::getStudentName),
            column("Grade", Registration::getGrade),
            column("School", Registration::getSchoolDisplayName),
            column("Contact", Registration::getContactNumber),
            column("Email", Registration::getEmail),
            column("Payment Status", r -> r.getPaymentStatus().getDisplayName()),
            column("Fee", r -> r.getWorkshop().getFee()),
            column("Registered Date", Registration::getRegisteredAt));

    @Autowired
    private IRegistrationRepository registrationRepository;

    @Autowired
    private SpreadsheetExporter spreadsheetExporter;

    private static ExportColumn<Registration> column(String header, Function<Registration, Object> value) {
        return new ExportColumn<>(header, value);
    }

    @Transactional(readOnly = true)
    public byte[] exportRegistrations(Long workshopId, RegistrationStatus status) {
        List<Registration> registrations = registrationRepository.search(workshopId, status, null);
        log.info("Exporting {} registrations (workshop: {}, status: {})", registrations.size(), workshopId, status);
        return spreadsheetExporter.renderSpreadsheet("Registrations", registrations, COLUMNS);
    }
}
