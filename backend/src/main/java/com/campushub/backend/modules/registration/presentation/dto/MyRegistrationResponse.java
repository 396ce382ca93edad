package com.campushub.backend.modules.registration.presentation.dto;

import java.time.OffsetDateTime;

import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.registration.domain.Registration;

public record MyRegistrationResponse(
        Long regId,
        Long eventId,
        String eventName,
        OffsetDateTime eventStartTime,
        OffsetDateTime regDate,
        String regStatus
) {

    public static MyRegistrationResponse from(Registration registration) {
        Event event = registration.getEvent();
        return new MyRegistrationResponse(
                registration.getId(),
                event.getId(),
                event.getName(),
                event.getStartTime(),
                registration.getRegisteredAt(),
                registration.getStatus().name()
        );
    }
}
