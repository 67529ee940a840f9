package com.tsc.service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.dto.DashboardDTO;
import com.tsc.dto.RegistrationResponseDTO;
import com.tsc.entity.RegistrationStatus;
import com.tsc.entity.Workshop;
import com.tsc.payment.entity.PaymentStatus;
import com.tsc.payment.repository.PaymentRepository;
import com.tsc.payment.service.PaymentRecordService;
import com.tsc.repository.IRegistrationRepository;
import com.tsc.repository.IWorkshopRepository;

@Service
public class DashboardService {

    @Autowired
    private IRegistrationRepository registrationRepository;

    @Autowired
    private IWorkshopRepository workshopRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private PaymentRecordService paymentRecordService;

    @Transactional(readOnly = true)
    public DashboardDTO getDashboard() {
        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (RegistrationStatus status : RegistrationStatus.values()) {
            breakdown.put(status.name(), registrationRepository.countByPaymentStatus(status));
        }

        List<DashboardDTO.WorkshopStats> workshopStats = workshopRepository.findAllByOrderByWorkshopDateAscNameAsc()
                .stream()
                .map(this::statsFor)
                .collect(Collectors.toList());

        List<RegistrationResponseDTO> recent = registrationRepository.findTop10ByOrderByRegisteredAtDesc().stream()
                .map(RegistrationResponseDTO::fromEntity)
                .collect(Collectors.toList());

        return DashboardDTO.builder()
                .totalRegistrations(registrationRepository.count())
                .totalRevenue(paymentRecordService.getPaymentStatistics().getRevenue())
                .activeWorkshops(workshopRepository.countByActiveTrue())
                .pendingPayments(breakdown.get(RegistrationStatus.PENDING.name()))
                .statusBreakdown(breakdown)
                .workshopStats(workshopStats)
                .recentRegistrations(recent)
                .build();
    }

    private DashboardDTO.WorkshopStats statsFor(Workshop workshop) {
        BigDecimal revenue = paymentRepository.sumAmountByWorkshopAndStatus(workshop.getId(), PaymentStatus.COMPLETED);
        return DashboardDTO.WorkshopStats.builder()
                .workshopId(workshop.getId())
                .name(workshop.getName())
                .capacity(workshop.getCapacity())
                .participants(registrationRepository.countByWorkshopId(workshop.getId()))
                .completed(registrationRepository.countByWorkshopIdAndPaymentStatus(workshop.getId(), RegistrationStatus.COMPLETED))
                .pending(registrationRepository.countByWorkshopIdAndPaymentStatus(workshop.getId(), RegistrationStatus.PENDING))
                .free(registrationRepository.countByWorkshopIdAndPaymentStatus(workshop.getId(), RegistrationStatus.FREE))
                .revenue(revenue != null ? revenue : BigDecimal.ZERO)
                .build();
    }
}
