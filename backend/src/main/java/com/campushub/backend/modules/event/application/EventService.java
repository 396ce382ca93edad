package com.campushub.backend.modules.event.application;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.event.domain.EventStatus;
import com.campushub.backend.modules.event.domain.Venue;
import com.campushub.backend.modules.event.infrastructure.persistence.EventRepository;
import com.campushub.backend.modules.event.infrastructure.persistence.VenueRepository;
import com.campushub.backend.modules.event.presentation.dto.CreateEventRequest;
import com.campushub.backend.modules.event.presentation.dto.EventResponse;
import com.campushub.backend.modules.event.presentation.dto.UpdateEventRequest;
import com.campushub.backend.modules.registration.domain.RegistrationStatus;
import com.campushub.backend.modules.registration.infrastructure.persistence.RegistrationRepository;
import com.campushub.backend.modules.registration.infrastructure.persistence.RegistrationRepository.ConfirmedCountProjection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventRepository eventRepository;
    private final VenueRepository venueRepository;
    private final RegistrationRepository registrationRepository;

    public EventService(
            EventRepository eventRepository,
            VenueRepository venueRepository,
            RegistrationRepository registrationRepository
    ) {
        this.eventRepository = eventRepository;
        this.venueRepository = venueRepository;
        this.registrationRepository = registrationRepository;
    }

    public EventResponse createEvent(CreateEventRequest request) {
        Venue venue = lockVenue(request.venueId());
        ensureTimeRange(request.startTime(), request.endTime());
        ensureSlotsFitVenue(request.maxSlots(), venue);

        Event event = new Event();
        event.setName(request.name().trim());
        event.setDescription(request.description());
        event.setStartTime(request.startTime());
        event.setEndTime(request.endTime());
        event.setMaxSlots(request.maxSlots());
        event.setVenue(venue);
        event.setRegistrationFee(request.registrationFee() != null ? request.registrationFee() : BigDecimal.ZERO);
        event.setStatus(request.status() != null ? request.status() : EventStatus.DRAFT);
        event.setPublished(false);
        eventRepository.saveAndFlush(event);

        log.info("Created event id={} venue={} maxSlots={}", event.getId(), venue.getId(), event.getMaxSlots());
        return EventResponse.from(event, 0L);
    }

    /**
     * 시작 시각 내림차순으로 행사를 조회한다. 관리자가 아니면 게시된 행사만 보인다.
     */
    @Transactional(readOnly = true)
    public List<EventResponse> listEvents(EventStatus status, Boolean published, Long venueId, boolean admin) {
        Boolean effectivePublished = admin ? published : Boolean.TRUE;
        List<Event> events = eventRepository.search(status, effectivePublished, venueId);
        if (events.isEmpty()) {
            return List.of();
        }
        Map<Long, Long> confirmed = registrationRepository
                .countConfirmedByEventIds(events.stream().map(Event::getId).toList())
                .stream()
                .collect(Collectors.toMap(ConfirmedCountProjection::getEventId, ConfirmedCountProjection::getConfirmedCount));
        return events.stream()
                .map(event -> EventResponse.from(event, confirmed.getOrDefault(event.getId(), 0L)))
                .toList();
    }

    @Transactional(readOnly = true)
    public EventResponse getEvent(Long eventId, boolean admin) {
        Event event = eventRepository.findWithVenueById(eventId)
                .orElseThrow(() -> eventNotFound(eventId));
        if (!event.isPublished() && !admin) {
            throw eventNotFound(eventId);
        }
        return EventResponse.from(event, confirmedCount(eventId));
    }

    public EventResponse updateEvent(Long eventId, UpdateEventRequest request) {
        if (request == null || request.isEmpty()) {
            throw ProblemException.badRequest("NO_UPDATE_FIELDS", "No fields to update");
        }
        Event event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> eventNotFound(eventId));
        if (request.hasStructuralChanges()
                && (event.isPublished() || registrationRepository.countOccupiedSlots(eventId) > 0)) {
            throw ProblemException.conflict(
                    "EVENT_LOCKED",
                    "Published events and events with confirmed or attended registrations only accept status changes"
            );
        }

        Venue venue = lockVenue(request.venueId() != null ? request.venueId() : event.getVenue().getId());
        OffsetDateTime start = request.startTime() != null ? request.startTime() : event.getStartTime();
        OffsetDateTime end = request.endTime() != null ? request.endTime() : event.getEndTime();
        int maxSlots = request.maxSlots() != null ? request.maxSlots() : event.getMaxSlots();
        ensureTimeRange(start, end);
        ensureSlotsFitVenue(maxSlots, venue);

        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw ProblemException.badRequest("INVALID_INPUT", "name must not be blank");
            }
            event.setName(request.name().trim());
        }
        if (request.description() != null) {
            event.setDescription(request.description());
        }
        if (request.registrationFee() != null) {
            event.setRegistrationFee(request.registrationFee());
        }
        if (request.status() != null) {
            event.setStatus(request.status());
        }
        event.setVenue(venue);
        event.setStartTime(start);
        event.setEndTime(end);
        event.setMaxSlots(maxSlots);
        eventRepository.flush();

        log.info("Updated event id={} status={}", eventId, event.getStatus());
        return EventResponse.from(event, confirmedCount(eventId));
    }

    public void deleteEvent(Long eventId) {
        Event event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> eventNotFound(eventId));
        if (registrationRepository.existsByEventId(eventId)) {
            throw ProblemException.conflict("EVENT_HAS_REGISTRATIONS", "Cannot delete an event that has registrations");
        }
        eventRepository.delete(event);
        log.info("Deleted event id={}", eventId);
    }

    public EventResponse publish(Long eventId) {
        Event event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> eventNotFound(eventId));
        if (event.isPublished()) {
            throw ProblemException.conflict("EVENT_ALREADY_PUBLISHED", "Event is already published");
        }
        if (event.getStatus().isClosed()) {
            throw ProblemException.conflict("EVENT_NOT_OPEN", "Cancelled or completed events cannot be published");
        }
        if (event.getVenue() == null || event.getStartTime() == null || event.getEndTime() == null) {
            throw ProblemException.badRequest(
                    "INCOMPLETE_EVENT",
                    "Event must have venue, start time, and end time to be published"
            );
        }
        event.setPublished(true);
        eventRepository.flush();
        log.info("Published event id={}", eventId);
        return EventResponse.from(event, confirmedCount(eventId));
    }

    public EventResponse unpublish(Long eventId) {
        Event event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> eventNotFound(eventId));
        if (!event.isPublished()) {
            throw ProblemException.conflict("EVENT_NOT_PUBLISHED", "Event is not published");
        }
        event.setPublished(false);
        eventRepository.flush();
        log.info("Unpublished event id={}", eventId);
        return EventResponse.from(event, confirmedCount(eventId));
    }

    private long confirmedCount(Long eventId) {
        return registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.CONFIRMED);
    }

    /**
     * 정원 비교 동안 장소 수용 인원이 바뀌지 않도록 장소 행을 잠근다.
     */
    private Venue lockVenue(Long venueId) {
        return venueRepository.findByIdForUpdate(venueId)
                .orElseThrow(() -> ProblemException.notFound("VENUE_NOT_FOUND", "Venue not found: " + venueId));
    }

    private static void ensureTimeRange(OffsetDateTime start, OffsetDateTime end) {
        if (!start.isBefore(end)) {
            throw ProblemException.badRequest("INVALID_TIME_RANGE", "startTime must be before endTime");
        }
    }

    private static void ensureSlotsFitVenue(int maxSlots, Venue venue) {
        if (maxSlots > venue.getCapacity()) {
            throw ProblemException.badRequest(
                    "INVALID_MAX_SLOTS",
                    "maxSlots (" + maxSlots + ") exceeds venue capacity (" + venue.getCapacity() + ")"
            );
        }
    }

    private static ProblemException eventNotFound(Long eventId) {
        return ProblemException.notFound("EVENT_NOT_FOUND", "Event not found: " + eventId);
    }
}
