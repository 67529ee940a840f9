package com.tsc.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.dto.MarkCompletedResponseDTO;
import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.payment.service.PaymentRecordService;
import com.tsc.repository.IRegistrationRepository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class AdminService {

	@Autowired
	private IRegistrationRepository registrationRepository;

	@Autowired
	private PaymentRecordService paymentRecordService;

	/**
	 * Administrative override to completed. Bypasses gateway validation and the amount check;
	 * free and already completed registrations are skipped. Every change is written to the
	 * audit log.
	 */
	@Transactional
	public MarkCompletedResponseDTO markAsCompleted(List<String> registrationNumbers, String adminName) {
		List<String> updated = new ArrayList<>();
		List<String> skipped = new ArrayList<>();

		for (String registrationNumber : new LinkedHashSet<>(registrationNumbers)) {
			Optional<Registration> registrationOpt = registrationRepository.findByRegistrationNumber(registrationNumber);
			if (registrationOpt.isEmpty()) {
				skipped.add(registrationNumber);
				continue;
			}

			Registration registration = registrationOpt.get();
			RegistrationStatus previous = registration.getPaymentStatus();
			if (paymentRecordService.overrideCompleted(registration)) {
				log.info("AUDIT admin={} action=mark-completed registration={} from={} to={}",
						adminName, registrationNumber, previous, RegistrationStatus.COMPLETED);
				updated.add(registrationNumber);
			} else {
				skipped.add(registrationNumber);
			}
		}

		log.info("Admin {} marked {} registration(s) as completed, skipped {}", adminName, updated.size(), skipped.size());
		return new MarkCompletedResponseDTO(updated.size(), updated, skipped);
	}
}
