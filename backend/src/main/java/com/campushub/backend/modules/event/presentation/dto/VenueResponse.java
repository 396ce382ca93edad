package com.campushub.backend.modules.event.presentation.dto;

import com.campushub.backend.modules.event.domain.Venue;

public record VenueResponse(Long id, String name, String location, int capacity) {

    public static VenueResponse from(Venue venue) {
        return new VenueResponse(venue.getId(), venue.getName(), venue.getLocation(), venue.getCapacity());
    }
}
