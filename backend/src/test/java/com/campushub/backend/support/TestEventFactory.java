package com.campushub.backend.support;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.event.domain.EventStatus;
import com.campushub.backend.modules.event.domain.Venue;
import com.campushub.backend.modules.event.infrastructure.persistence.EventRepository;
import com.campushub.backend.modules.event.infrastructure.persistence.VenueRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestEventFactory {

    private final EventRepository eventRepository;
    private final VenueRepository venueRepository;

    public TestEventFactory(EventRepository eventRepository, VenueRepository venueRepository) {
        this.eventRepository = eventRepository;
        this.venueRepository = venueRepository;
    }

    public Venue createVenue(String name, int capacity) {
        Venue venue = new Venue();
        venue.setName(name);
        venue.setLocation("Test Block");
        venue.setCapacity(capacity);
        return venueRepository.save(venue);
    }

    public Event createPublishedEvent(String name, int maxSlots) {
        return createEvent(name, maxSlots, true, EventStatus.ACTIVE);
    }

    public Event createEvent(String name, int maxSlots, boolean published, EventStatus status) {
        return createEvent(name, maxSlots, published, status, createVenue(name + " venue", Math.max(maxSlots, 10)));
    }

    public Event createEvent(String name, int maxSlots, boolean published, EventStatus status, Venue venue) {
        OffsetDateTime start = OffsetDateTime.now(ZoneOffset.UTC).plusDays(7).withNano(0);

        Event event = new Event();
        event.setName(name);
        event.setDescription("Integration test event");
        event.setStartTime(start);
        event.setEndTime(start.plusHours(2));
        event.setMaxSlots(maxSlots);
        event.setVenue(venue);
        event.setRegistrationFee(BigDecimal.ZERO);
        event.setStatus(status);
        event.setPublished(published);
        return eventRepository.save(event);
    }
}
