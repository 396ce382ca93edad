package com.campushub.backend.modules.event.application;

import java.util.List;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.modules.event.domain.Venue;
import com.campushub.backend.modules.event.infrastructure.persistence.EventRepository;
import com.campushub.backend.modules.event.infrastructure.persistence.VenueRepository;
import com.campushub.backend.modules.event.presentation.dto.UpdateVenueRequest;
import com.campushub.backend.modules.event.presentation.dto.VenueRequest;
import com.campushub.backend.modules.event.presentation.dto.VenueResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class VenueService {

    private static final Logger log = LoggerFactory.getLogger(VenueService.class);

    private final VenueRepository venueRepository;
    private final EventRepository eventRepository;

    public VenueService(VenueRepository venueRepository, EventRepository eventRepository) {
        this.venueRepository = venueRepository;
        this.eventRepository = eventRepository;
    }

    @Transactional(readOnly = true)
    public List<VenueResponse> listVenues() {
        return venueRepository.findAllByOrderByNameAsc().stream()
                .map(VenueResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public VenueResponse getVenue(Long venueId) {
        return VenueResponse.from(loadVenue(venueId));
    }

    public VenueResponse createVenue(VenueRequest request) {
        Venue venue = new Venue();
        venue.setName(request.name().trim());
        venue.setLocation(request.location());
        venue.setCapacity(request.capacity());
        venueRepository.saveAndFlush(venue);
        log.info("Created venue id={} capacity={}", venue.getId(), venue.getCapacity());
        return VenueResponse.from(venue);
    }

    public VenueResponse updateVenue(Long venueId, UpdateVenueRequest request) {
        if (request == null || request.isEmpty()) {
            throw ProblemException.badRequest("NO_UPDATE_FIELDS", "No fields to update");
        }
        Venue venue = venueRepository.findByIdForUpdate(venueId)
                .orElseThrow(() -> venueNotFound(venueId));
        if (request.capacity() != null && request.capacity() < venue.getCapacity()
                && eventRepository.existsByVenueWithMaxSlotsAbove(venueId, request.capacity())) {
            throw ProblemException.conflict(
                    "VENUE_CAPACITY_CONFLICT",
                    "An event at this venue has more slots than the new capacity"
            );
        }
        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw ProblemException.badRequest("INVALID_INPUT", "name must not be blank");
            }
            venue.setName(request.name().trim());
        }
        if (request.location() != null) {
            venue.setLocation(request.location());
        }
        if (request.capacity() != null) {
            venue.setCapacity(request.capacity());
        }
        venueRepository.flush();
        log.info("Updated venue id={} capacity={}", venueId, venue.getCapacity());
        return VenueResponse.from(venue);
    }

    private Venue loadVenue(Long venueId) {
        return venueRepository.findById(venueId)
                .orElseThrow(() -> venueNotFound(venueId));
    }

    private static ProblemException venueNotFound(Long venueId) {
        return ProblemException.notFound("VENUE_NOT_FOUND", "Venue not found: " + venueId);
    }
}
