package com.tsc.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardDTO {

    private long totalRegistrations;
    private BigDecimal totalRevenue;
    private long activeWorkshops;
    private long pendingPayments;
    private Map<String, Long> statusBreakdown;
    private List<WorkshopStats> workshopStats;
    private List<RegistrationResponseDTO> recentRegistrations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkshopStats {
        private Long workshopId;
        private String name;
        private int capacity;
        private long participants;
        private long completed;
        private long pending;
        private long free;
        private BigDecimal revenue;
    }
}
