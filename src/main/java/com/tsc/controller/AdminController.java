package com.tsc.controller;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tsc.dto.DashboardDTO;
import com.tsc.dto.MarkCompletedRequestDTO;
import com.tsc.dto.MarkCompletedResponseDTO;
import com.tsc.dto.RegistrationResponseDTO;
import com.tsc.dto.SchoolRequestDTO;
import com.tsc.dto.WorkshopRequestDTO;
import com.tsc.dto.WorkshopResponseDTO;
import com.tsc.entity.RegistrationStatus;
import com.tsc.entity.School;
import com.tsc.payment.dto.PaymentResponseDTO;
import com.tsc.payment.entity.PaymentStatus;
import com.tsc.payment.service.PaymentRecordService;
import com.tsc.service.AdminService;
import com.tsc.service.DashboardService;
import com.tsc.service.RegistrationExportService;
import com.tsc.service.RegistrationService;
import com.tsc.service.SchoolService;
import com.tsc.service.WorkshopService;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/admin/api")
@Slf4j
public class AdminController {

	private static final MediaType XLSX =
			MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

	@Autowired
	private AdminService adminService;

	@Autowired
	private WorkshopService workshopService;

	@Autowired
	private SchoolService schoolService;

	@Autowired
	private RegistrationService registrationService;

	@Autowired
	private RegistrationExportService registrationExportService;

	@Autowired
	private PaymentRecordService paymentRecordService;

	@Autowired
	private DashboardService dashboardService;

	// Workshops

	@GetMapping("/workshops")
	public ResponseEntity<List<WorkshopResponseDTO>> getAllWorkshops() {
		return ResponseEntity.ok(workshopService.getAllWorkshops());
	}

	@PostMapping("/workshops")
	public ResponseEntity<WorkshopResponseDTO> createWorkshop(@Valid @RequestBody WorkshopRequestDTO request) {
		return ResponseEntity.status(HttpStatus.CREATED).body(workshopService.createWorkshop(request));
	}

	@PutMapping("/workshops/{id}")
	public ResponseEntity<WorkshopResponseDTO> updateWorkshop(@PathVariable Long id,
			@Valid @RequestBody WorkshopRequestDTO request) {
		return ResponseEntity.ok(workshopService.updateWorkshop(id, request));
	}

	@DeleteMapping("/workshops/{id}")
	public ResponseEntity<Void> deleteWorkshop(@PathVariable Long id) {
		workshopService.deleteWorkshop(id);
		return ResponseEntity.noContent().build();
	}

	// Schools

	@GetMapping("/schools")
	public ResponseEntity<List<School>> getAllSchools() {
		return ResponseEntity.ok(schoolService.getAllSchools());
	}

	@PostMapping("/schools")
	public ResponseEntity<School> createSchool(@Valid @RequestBody SchoolRequestDTO request) {
		return ResponseEntity.status(HttpStatus.CREATED).body(schoolService.createSchool(request.getName()));
	}

	@PostMapping("/schools/{id}/deactivate")
	public ResponseEntity<School> deactivateSchool(@PathVariable Long id) {
		return ResponseEntity.ok(schoolService.deactivateSchool(id));
	}

	@PostMapping("/schools/backfill")
	public ResponseEntity<Map<String, Integer>> backfillSchools(Principal principal) {
		log.info("School backfill started by {}", principal.getName());
		return ResponseEntity.ok(Map.of("linked", schoolService.backfillSchools()));
	}

	// Registrations

	@GetMapping("/registrations")
	public ResponseEntity<List<RegistrationResponseDTO>> searchRegistrations(
			@RequestParam(required = false) Long workshopId,
			@RequestParam(required = false) RegistrationStatus status,
			@RequestParam(required = false) String search) {
		return ResponseEntity.ok(registrationService.search(workshopId, status, search));
	}

	@PostMapping("/registrations/mark-completed")
	public ResponseEntity<MarkCompletedResponseDTO> markCompleted(@Valid @RequestBody MarkCompletedRequestDTO request,
			Principal principal) {
		return ResponseEntity.ok(adminService.markAsCompleted(request.getRegistrationNumbers(), principal.getName()));
	}

	@GetMapping("/registrations/export")
	public ResponseEntity<byte[]> exportRegistrations(@RequestParam(required = false) Long workshopId,
			@RequestParam(required = false) RegistrationStatus status) {
		byte[] workbook = registrationExportService.exportRegistrations(workshopId, status);

		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(XLSX);
		headers.setContentDisposition(ContentDisposition.attachment().filename("registrations.xlsx").build());
		return new ResponseEntity<>(workbook, headers, HttpStatus.OK);
	}

	// Payments

	@GetMapping("/payments")
	public ResponseEntity<List<PaymentResponseDTO>> getPayments(@RequestParam(required = false) PaymentStatus status) {
		return ResponseEntity.ok((status == null ? paymentRecordService.findAll() : paymentRecordService.findByStatus(status))
				.stream()
				.map(PaymentResponseDTO::fromEntity)
				.collect(Collectors.toList()));
	}

	@GetMapping("/dashboard")
	public ResponseEntity<DashboardDTO> getDashboard() {
		return ResponseEntity.ok(dashboardService.getDashboard());
	}
}
