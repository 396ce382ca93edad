package com.campushub.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import com.campushub.backend.modules.event.domain.EventStatus;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * 행사 부분 수정. {@code null} 필드는 변경하지 않는다.
 */
public record UpdateEventRequest(
        @Size(max = 200) String name,
        String description,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        @Positive Integer maxSlots,
        @Positive Long venueId,
        @PositiveOrZero BigDecimal registrationFee,
        EventStatus status
) {

    public boolean isEmpty() {
        return !hasStructuralChanges() && status == null;
    }

    public boolean hasStructuralChanges() {
        return name != null
                || description != null
                || startTime != null
                || endTime != null
                || maxSlots != null
                || venueId != null
                || registrationFee != null;
    }
}
