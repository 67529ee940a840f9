package com.tsc.service;

import com.tsc.dto.MarkCompletedResponseDTO;
import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;
import com.tsc.payment.service.PaymentRecordService;
import com.tsc.repository.IRegistrationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminServiceTest {

	@Mock
	private IRegistrationRepository mockRegistrationRepository;

	@Mock
	private PaymentRecordService mockPaymentRecordService;

	@InjectMocks
	private AdminService adminService;

	private Registration registration(String number, RegistrationStatus status) {
		return Registration.builder().registrationNumber(number).paymentStatus(status).build();
	}

	@Test
	void markAsCompleted_MixedSelection_ReportsUpdatedAndSkipped() {
		// Given
		Registration pending = registration("REG-20260315-AAAAA", RegistrationStatus.PENDING);
		Registration free = registration("REG-20260315-BBBBB", RegistrationStatus.FREE);
		when(mockRegistrationRepository.findByRegistrationNumber("REG-20260315-AAAAA")).thenReturn(Optional.of(pending));
		when(mockRegistrationRepository.findByRegistrationNumber("REG-20260315-BBBBB")).thenReturn(Optional.of(free));
		when(mockRegistrationRepository.findByRegistrationNumber("REG-20260315-CCCCC")).thenReturn(Optional.empty());
		when(mockPaymentRecordService.overrideCompleted(pending)).thenReturn(true);
		when(mockPaymentRecordService.overrideCompleted(free)).thenReturn(false);

		// When
		MarkCompletedResponseDTO response = adminService.markAsCompleted(
				List.of("REG-20260315-AAAAA", "REG-20260315-BBBBB", "REG-20260315-CCCCC"), "registrar");

		// Then
		assertThat(response.getUpdated()).isEqualTo(1);
		assertThat(response.getUpdatedRegistrations()).containsExactly("REG-20260315-AAAAA");
		assertThat(response.getSkippedRegistrations()).containsExactly("REG-20260315-BBBBB", "REG-20260315-CCCCC");
	}

	@Test
	void markAsCompleted_RepeatedNumber_IsProcessedOnce() {
		Registration pending = registration("REG-20260315-AAAAA", RegistrationStatus.PENDING);
		when(mockRegistrationRepository.findByRegistrationNumber("REG-20260315-AAAAA")).thenReturn(Optional.of(pending));
		when(mockPaymentRecordService.overrideCompleted(pending)).thenReturn(true);

		MarkCompletedResponseDTO response = adminService.markAsCompleted(
				List.of("REG-20260315-AAAAA", "REG-20260315-AAAAA"), "registrar");

		assertThat(response.getUpdated()).isEqualTo(1);
		verify(mockPaymentRecordService, times(1)).overrideCompleted(pending);
	}
}
