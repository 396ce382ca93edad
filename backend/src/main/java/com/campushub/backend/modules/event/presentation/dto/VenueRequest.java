package com.campushub.backend.modules.event.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record VenueRequest(
        @NotBlank(message = "name is required") @Size(max = 150) String name,
        @Size(max = 255) String location,
        @NotNull(message = "capacity is required") @Positive(message = "capacity must be positive") Integer capacity
) {
}
