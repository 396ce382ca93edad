package com.campushub.backend.modules.event.domain;

public enum EventStatus {
    DRAFT,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isClosed() {
        return this == COMPLETED || this == CANCELLED;
    }
}
