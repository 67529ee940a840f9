package com.tsc.dto;

import lombok.Data;

@Data
public class RegistrationRequestDTO {
    private String studentName;
    // Kept as text so a non-numeric grade is reported as an invalid grade
    private String grade;
    private Long schoolId;
    private String contactNumber;
    private String email;
    private boolean termsAgreed;
}
