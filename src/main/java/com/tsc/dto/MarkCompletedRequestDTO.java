package com.tsc.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class MarkCompletedRequestDTO {

    @NotEmpty(message = "At least one registration number is required")
    private List<String> registrationNumbers;
}
