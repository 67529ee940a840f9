package com.tsc.dto;

import java.math.BigDecimal;

import com.tsc.entity.Workshop;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkshopResponseDTO {
    private Long id;
    private String name;
    private String description;
    private String workshopDate;
    private String time;
    private String duration;
    private String venue;
    private BigDecimal fee;
    private int capacity;
    private boolean active;
    private String organizer;

    private boolean free;
    private long currentRegistrations;
    private long availableSlots;
    private boolean full;

    public static WorkshopResponseDTO fromEntity(Workshop workshop, long currentRegistrations, long availableSlots,
                                                 boolean full) {
        return WorkshopResponseDTO.builder()
            .id(workshop.getId())
            .name(workshop.getName())
            .description(workshop.getDescription())
            .workshopDate(workshop.getWorkshopDate())
            .time(workshop.getTime())
            .duration(workshop.getDuration())
            .venue(workshop.getVenue())
            .fee(workshop.getFee())
            .capacity(workshop.getCapacity())
            .active(workshop.isActive())
            .organizer(workshop.getOrganizer())
            .free(workshop.isFree())
            .currentRegistrations(currentRegistrations)
            .availableSlots(availableSlots)
            .full(full)
            .build();
    }
}
