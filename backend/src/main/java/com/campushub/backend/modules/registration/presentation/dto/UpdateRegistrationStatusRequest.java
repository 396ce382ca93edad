package com.campushub.backend.modules.registration.presentation.dto;

import com.campushub.backend.modules.registration.domain.RegistrationStatus;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateRegistrationStatusRequest(
        @NotNull(message = "status is required") RegistrationStatus status,
        @Size(max = 500, message = "reason must be at most 500 characters") String reason
) {
}
