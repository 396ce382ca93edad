package com.campushub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record SignupRequest(
        @NotBlank(message = "studentId is required") String studentId,
        @NotBlank(message = "username is required") String username,
        @NotBlank(message = "fullName is required") String fullName,
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "phone is required") String phone,
        @NotNull(message = "branchId is required") @Positive Long branchId,
        @NotNull(message = "graduationYear is required") Integer graduationYear
) {
}
