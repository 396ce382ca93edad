package com.campushub.backend.modules.registration.presentation.dto;

import java.time.OffsetDateTime;

import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.registration.domain.Registration;

public record EventRegistrationResponse(
        Long regId,
        OffsetDateTime regDate,
        String regStatus,
        String statusReason,
        Long userId,
        String fullName,
        String email,
        String studentId,
        String phone
) {

    public static EventRegistrationResponse from(Registration registration) {
        CampusUser user = registration.getUser();
        return new EventRegistrationResponse(
                registration.getId(),
                registration.getRegisteredAt(),
                registration.getStatus().name(),
                registration.getStatusReason(),
                user.getId(),
                user.getFullName(),
                user.getEmail(),
                user.getStudentId(),
                user.getPhone()
        );
    }
}
