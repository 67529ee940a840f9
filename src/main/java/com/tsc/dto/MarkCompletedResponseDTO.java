package com.tsc.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkCompletedResponseDTO {
    private int updated;
    private List<String> updatedRegistrations;
    // Free, already completed or unknown numbers
    private List<String> skippedRegistrations;
}
