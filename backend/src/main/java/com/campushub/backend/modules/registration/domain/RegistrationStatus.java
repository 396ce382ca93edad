package com.campushub.backend.modules.registration.domain;

public enum RegistrationStatus {
    PENDING,
    CONFIRMED,
    ATTENDED,
    CANCELLED,
    WAITLISTED
}
