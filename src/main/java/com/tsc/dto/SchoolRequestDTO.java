package com.tsc.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SchoolRequestDTO {

    @NotBlank(message = "School name is required")
    private String name;
}
