package com.tsc.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.config.RegistrationProperties;
import com.tsc.dto.WorkshopRequestDTO;
import com.tsc.dto.WorkshopResponseDTO;
import com.tsc.entity.Workshop;
import com.tsc.exception.ResourceNotFoundException;
import com.tsc.payment.entity.PaymentStatus;
import com.tsc.payment.repository.PaymentRepository;
import com.tsc.repository.IRegistrationRepository;
import com.tsc.repository.IWorkshopRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Workshop catalog and seat accounting. Seat counts are computed on read.
 */
@Service
@Slf4j
public class WorkshopService {

    @Autowired
    private IWorkshopRepository workshopRepository;

    @Autowired
    private IRegistrationRepository registrationRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private RegistrationProperties registrationProperties;

    /**
     * Completed registrations, plus free ones while the workshop is free.
     */
    @Transactional(readOnly = true)
    public long currentRegistrations(Workshop workshop) {
        return registrationRepository.countConfirmedByWorkshopId(workshop.getId());
    }

    /**
     * Seats held by payments still in flight. Always zero unless strict mode is on.
     */
    @Transactional(readOnly = true)
    public long reservedSlots(Workshop workshop) {
        if (!registrationProperties.isStrictMode()) {
            return 0;
        }
        return paymentRepository.countByRegistrationWorkshopIdAndStatus(workshop.getId(), PaymentStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public long occupiedSlots(Workshop workshop) {
        return currentRegistrations(workshop) + reservedSlots(workshop);
    }

    @Transactional(readOnly = true)
    public boolean isFull(Workshop workshop) {
        return occupiedSlots(workshop) >= workshop.getCapacity();
    }

    @Transactional(readOnly = true)
    public long availableSlots(Workshop workshop) {
        return Math.max(0, workshop.getCapacity() - occupiedSlots(workshop));
    }

    @Transactional(readOnly = true)
    public List<WorkshopResponseDTO> getActiveWorkshops() {
        return workshopRepository.findByActiveTrueOrderByWorkshopDateAscNameAsc().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<WorkshopResponseDTO> getAllWorkshops() {
        return workshopRepository.findAllByOrderByWorkshopDateAscNameAsc().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public WorkshopResponseDTO getActiveWorkshop(Long id) {
        Workshop workshop = workshopRepository.findById(id)
                .filter(Workshop::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Workshop not found: " + id));
        return toResponse(workshop);
    }

    public WorkshopResponseDTO toResponse(Workshop workshop) {
        long current = currentRegistrations(workshop);
        long occupied = current + reservedSlots(workshop);
        return WorkshopResponseDTO.fromEntity(workshop, current,
                Math.max(0, workshop.getCapacity() - occupied), occupied >= workshop.getCapacity());
    }

    @Transactional
    public WorkshopResponseDTO createWorkshop(WorkshopRequestDTO request) {
        Workshop workshop = new Workshop();
        apply(workshop, request);
        Workshop saved = workshopRepository.save(workshop);
        log.info("Created workshop {} '{}' fee: {} capacity: {}",
                saved.getId(), saved.getName(), saved.getFee(), saved.getCapacity());
        return toResponse(saved);
    }

    @Transactional
    public WorkshopResponseDTO updateWorkshop(Long id, WorkshopRequestDTO request) {
        Workshop workshop = workshopRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Workshop not found: " + id));
        apply(workshop, request);
        Workshop saved = workshopRepository.save(workshop);
        log.info("Updated workshop {} '{}'", saved.getId(), saved.getName());
        return toResponse(saved);
    }

    @Transactional
    public void deleteWorkshop(Long id) {
        Workshop workshop = workshopRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Workshop not found: " + id));
        if (registrationRepository.existsByWorkshopId(id)) {
            throw new IllegalStateException("Workshop '" + workshop.getName()
                    + "' has registrations and cannot be deleted. Deactivate it instead.");
        }
        workshopRepository.delete(workshop);
        log.info("Deleted workshop {} '{}'", id, workshop.getName());
    }

    private void apply(Workshop workshop, WorkshopRequestDTO request) {
        workshop.setName(request.getName());
        workshop.setDescription(request.getDescription());
        workshop.setWorkshopDate(request.getWorkshopDate());
        workshop.setTime(request.getTime());
        workshop.setDuration(request.getDuration());
        workshop.setVenue(request.getVenue());
        workshop.setFee(request.getFee());
        workshop.setCapacity(request.getCapacity());
        workshop.setActive(request.isActive());
        workshop.setOrganizer(request.getOrganizer());
    }
}
