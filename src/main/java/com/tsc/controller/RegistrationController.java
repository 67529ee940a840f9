package com.tsc.controller;

import java.time.LocalDateTime;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tsc.dto.RegistrationRequestDTO;
import com.tsc.dto.RegistrationResponseDTO;
import com.tsc.exception.ErrorResponse;
import com.tsc.service.ReceiptService;
import com.tsc.service.RegistrationResult;
import com.tsc.service.RegistrationService;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api")
@Slf4j
public class RegistrationController {

    @Autowired
    private RegistrationService registrationService;

    @Autowired
    private ReceiptService receiptService;

    @PostMapping("/workshops/{workshopId}/registrations")
    public ResponseEntity<?> register(@PathVariable Long workshopId, @RequestBody RegistrationRequestDTO request,
                                      HttpServletRequest httpRequest) {
        log.info("Registration request for workshop {} from {}", workshopId, request.getEmail());

        RegistrationResult result = registrationService.submit(workshopId, request);
        if (!result.isSuccess()) {
            HttpStatus status = result.getError().getHttpStatus();
            log.info("Registration for workshop {} refused: {}", workshopId, result.getError());
            ErrorResponse error = new ErrorResponse(status.value(), result.getError().name(), result.getMessage(),
                    LocalDateTime.now(), "uri=" + httpRequest.getRequestURI());
            return ResponseEntity.status(status).body(error);
        }

        return ResponseEntity.status(HttpStatus.CREATED).body(RegistrationResponseDTO.fromEntity(result.getRegistration()));
    }

    @GetMapping("/registrations/{registrationNumber}")
    public ResponseEntity<RegistrationResponseDTO> getRegistration(@PathVariable String registrationNumber) {
        return ResponseEntity.ok(registrationService.getRegistrationView(registrationNumber));
    }

    @GetMapping("/registrations/{registrationNumber}/receipt")
    public ResponseEntity<byte[]> downloadReceipt(@PathVariable String registrationNumber) {
        byte[] pdf = receiptService.getReceipt(registrationNumber);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(ReceiptService.fileName(registrationNumber))
                .build());
        return new ResponseEntity<>(pdf, headers, HttpStatus.OK);
    }
}
