package com.campushub.backend.modules.registration.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

import com.campushub.backend.modules.registration.domain.Registration;

public record RegistrationResponse(
        Long regId,
        Long userId,
        Long eventId,
        OffsetDateTime regDate,
        String regStatus,
        @JsonInclude(JsonInclude.Include.NON_NULL) String statusReason
) {

    public static RegistrationResponse from(Registration registration) {
        return new RegistrationResponse(
                registration.getId(),
                registration.getUser().getId(),
                registration.getEvent().getId(),
                registration.getRegisteredAt(),
                registration.getStatus().name(),
                registration.getStatusReason()
        );
    }
}
