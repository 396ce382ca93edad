package com.campushub.backend.modules.event.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.event.domain.Venue;

public record EventResponse(
        Long id,
        String name,
        String description,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        int maxSlots,
        String status,
        boolean published,
        Long venueId,
        String venueName,
        BigDecimal registrationFee,
        long confirmedCount,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static EventResponse from(Event event, long confirmedCount) {
        Venue venue = event.getVenue();
        return new EventResponse(
                event.getId(),
                event.getName(),
                event.getDescription(),
                event.getStartTime(),
                event.getEndTime(),
                event.getMaxSlots(),
                event.getStatus().name(),
                event.isPublished(),
                venue.getId(),
                venue.getName(),
                event.getRegistrationFee(),
                confirmedCount,
                event.getCreatedAt(),
                event.getUpdatedAt()
        );
    }
}
