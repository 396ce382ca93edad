package com.campushub.backend.modules.event.presentation.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record UpdateVenueRequest(
        @Size(max = 150) String name,
        @Size(max = 255) String location,
        @Positive(message = "capacity must be positive") Integer capacity
) {

    public boolean isEmpty() {
        return name == null && location == null && capacity == null;
    }
}
