package com.campushub.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import com.campushub.backend.modules.event.domain.EventStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateEventRequest(
        @NotBlank(message = "name is required") @Size(max = 200) String name,
        String description,
        @NotNull(message = "startTime is required") OffsetDateTime startTime,
        @NotNull(message = "endTime is required") OffsetDateTime endTime,
        @NotNull(message = "maxSlots is required") @Positive Integer maxSlots,
        @NotNull(message = "venueId is required") @Positive Long venueId,
        @PositiveOrZero BigDecimal registrationFee,
        EventStatus status
) {
}
