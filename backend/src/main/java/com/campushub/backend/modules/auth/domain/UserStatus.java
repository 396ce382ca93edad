package com.campushub.backend.modules.auth.domain;

public enum UserStatus {
    ACTIVE,
    INACTIVE
}
