package com.tsc.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class WorkshopRequestDTO {

    @NotBlank(message = "Workshop name is required")
    private String name;

    private String description;
    private String workshopDate;
    private String time;
    private String duration;
    private String venue;

    @NotNull(message = "Fee is required")
    @DecimalMin(value = "0.00", message = "Fee must not be negative")
    private BigDecimal fee;

    @Min(value = 0, message = "Capacity must not be negative")
    private int capacity = 100;

    private boolean active = true;
    private String organizer;
}
