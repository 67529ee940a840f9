package com.tsc.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.dto.RegistrationRequestDTO;
import com.tsc.dto.RegistrationResponseDTO;
import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.entity.School;
import com.tsc.entity.Workshop;
import com.tsc.exception.ResourceNotFoundException;
import com.tsc.payment.entity.Payment;
import com.tsc.payment.repository.PaymentRepository;
import com.tsc.repository.IRegistrationRepository;
import com.tsc.repository.ISchoolRepository;
import com.tsc.repository.IWorkshopRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Accepts registration requests and owns registration numbering.
 * <p>
 * Refusals are returned as a {@link RegistrationResult}; the (email, workshop) and
 * registration number unique constraints remain the final word when two requests race.
 */
@Service
@Slf4j
public class RegistrationService {

    public static final Pattern PHONE_PATTERN = Pattern.compile("^(\\+8801|01)[3-9]\\d{8}$");
    public static final Pattern REGISTRATION_NUMBER_PATTERN = Pattern.compile("^REG-\\d{8}-[0-9A-F]{5}$");

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final int MIN_GRADE = 2;
    private static final int MAX_GRADE = 12;
    private static final int MAX_NUMBER_ATTEMPTS = 5;

    private final IRegistrationRepository registrationRepository;
    private final IWorkshopRepository workshopRepository;
    private final ISchoolRepository schoolRepository;
    private final PaymentRepository paymentRepository;
    private final WorkshopService workshopService;
    private final NotificationService notificationService;
    private final Clock clock;

    public RegistrationService(IRegistrationRepository registrationRepository,
                               IWorkshopRepository workshopRepository,
                               ISchoolRepository schoolRepository,
                               PaymentRepository paymentRepository,
                               WorkshopService workshopService,
                               NotificationService notificationService,
                               Clock clock) {
        this.registrationRepository = registrationRepository;
        this.workshopRepository = workshopRepository;
        this.schoolRepository = schoolRepository;
        this.paymentRepository = paymentRepository;
        this.workshopService = workshopService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public RegistrationResult submit(Long workshopId, RegistrationRequestDTO request) {
        Optional<Workshop> workshopOpt = workshopId == null ? Optional.empty() : workshopRepository.findById(workshopId);
        if (workshopOpt.isEmpty() || !workshopOpt.get().isActive()) {
            log.info("Registration refused, workshop {} is not open", workshopId);
            return RegistrationResult.failure(RegistrationError.WORKSHOP_CLOSED,
                    "This workshop is not accepting registrations.");
        }
        Workshop workshop = workshopOpt.get();

        if (workshopService.isFull(workshop)) {
            log.info("Registration refused, workshop {} is full (capacity {})", workshopId, workshop.getCapacity());
            return RegistrationResult.failure(RegistrationError.WORKSHOP_FULL,
                    "This workshop is full. Only " + workshop.getCapacity() + " slots were available.");
        }

        Integer grade = parseGrade(request.getGrade());
        if (grade == null) {
            return RegistrationResult.failure(RegistrationError.INVALID_GRADE, "Grade must be between 2 and 12.");
        }

        String phone = trim(request.getContactNumber());
        if (phone == null || !PHONE_PATTERN.matcher(phone).matches()) {
            return RegistrationResult.failure(RegistrationError.INVALID_PHONE,
                    "Phone number must be a valid Bangladesh number (e.g., 01712345678 or +8801712345678)");
        }

        String email = trim(request.getEmail());
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            return RegistrationResult.failure(RegistrationError.INVALID_EMAIL, "Enter a valid email address.");
        }
        email = email.toLowerCase(Locale.ROOT);

        if (registrationRepository.existsByEmailAndWorkshopId(email, workshop.getId())) {
            return duplicate(email, workshop);
        }

        if (!request.isTermsAgreed()) {
            return RegistrationResult.failure(RegistrationError.TERMS_NOT_ACCEPTED,
                    "You must agree to the terms and conditions.");
        }

        String studentName = trim(request.getStudentName());
        if (studentName == null || studentName.length() > 200) {
            return RegistrationResult.failure(RegistrationError.INVALID_NAME, "Student name is required.");
        }

        Optional<School> school = request.getSchoolId() == null
                ? Optional.empty()
                : schoolRepository.findById(request.getSchoolId()).filter(School::isActive);
        if (school.isEmpty()) {
            return RegistrationResult.failure(RegistrationError.UNKNOWN_SCHOOL, "Select your school.");
        }

        Registration registration = Registration.builder()
                .workshop(workshop)
                .studentName(studentName)
                .grade(grade)
                .school(school.get())
                .contactNumber(phone)
                .email(email)
                .paymentStatus(workshop.isFree() ? RegistrationStatus.FREE : RegistrationStatus.PENDING)
                .build();

        Registration saved = null;
        for (int attempt = 1; saved == null; attempt++) {
            registration.setRegistrationNumber(nextRegistrationNumber());
            try {
                saved = registrationRepository.saveAndFlush(registration);
            } catch (DataIntegrityViolationException e) {
                if (registrationRepository.existsByEmailAndWorkshopId(email, workshop.getId())) {
                    return duplicate(email, workshop);
                }
                if (attempt >= MAX_NUMBER_ATTEMPTS) {
                    throw e;
                }
                log.warn("Registration number {} collided, retrying", registration.getRegistrationNumber());
                registration.setId(null);
            }
        }

        log.info("Registered {} for workshop {} as {} ({})", saved.getEmail(), workshop.getId(),
                saved.getRegistrationNumber(), saved.getPaymentStatus());

        notificationService.sendConfirmation(saved);
        return RegistrationResult.success(saved);
    }

    /**
     * REG-YYYYMMDD-XXXXX with the date in the business zone and five hex digits from a random UUID.
     */
    public String nextRegistrationNumber() {
        String number;
        do {
            String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 5).toUpperCase(Locale.ROOT);
            number = "REG-" + LocalDate.now(clock).format(NUMBER_DATE) + "-" + suffix;
        } while (registrationRepository.existsByRegistrationNumber(number));
        return number;
    }

    @Transactional(readOnly = true)
    public Registration getByRegistrationNumber(String registrationNumber) {
        return registrationRepository.findByRegistrationNumber(registrationNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Registration not found: " + registrationNumber));
    }

    @Transactional(readOnly = true)
    public RegistrationResponseDTO getRegistrationView(String registrationNumber) {
        Registration registration = getByRegistrationNumber(registrationNumber);
        Payment payment = paymentRepository.findByRegistrationId(registration.getId()).orElse(null);
        return RegistrationResponseDTO.fromEntity(registration, payment);
    }

    @Transactional(readOnly = true)
    public List<RegistrationResponseDTO> search(Long workshopId, RegistrationStatus status, String search) {
        String pattern = search == null || search.isBlank()
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return registrationRepository.search(workshopId, status, pattern).stream()
                .map(RegistrationResponseDTO::fromEntity)
                .collect(Collectors.toList());
    }

    private RegistrationResult duplicate(String email, Workshop workshop) {
        log.info("Duplicate registration for {} on workshop {}", email, workshop.getId());
        return RegistrationResult.failure(RegistrationError.DUPLICATE_REGISTRATION,
                "This email is already registered for this workshop. "
                        + "Please use a different email or contact support.");
    }

    private static Integer parseGrade(String value) {
        String trimmed = trim(value);
        if (trimmed == null) {
            return null;
        }
        try {
            int grade = Integer.parseInt(trimmed);
            return grade >= MIN_GRADE && grade <= MAX_GRADE ? grade : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trim(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
