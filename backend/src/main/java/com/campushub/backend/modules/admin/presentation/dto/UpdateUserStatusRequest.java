package com.campushub.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateUserStatusRequest(
        @NotBlank(message = "status is required") String status,
        @Size(max = 255) String reason
) {
}
