package com.campushub.backend.modules.event.presentation;

import java.util.List;

import com.campushub.backend.global.security.JwtAuthenticationPrincipal;
import com.campushub.backend.modules.auth.application.UserInputValidator;
import com.campushub.backend.modules.event.application.EventService;
import com.campushub.backend.modules.event.domain.EventStatus;
import com.campushub.backend.modules.event.presentation.dto.CreateEventRequest;
import com.campushub.backend.modules.event.presentation.dto.EventResponse;
import com.campushub.backend.modules.event.presentation.dto.UpdateEventRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/events")
@Tag(name = "Events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @Operation(summary = "Create an event (admin)", description = "Events start unpublished with status DRAFT unless given.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Event created"),
            @ApiResponse(responseCode = "400", description = "`INVALID_MAX_SLOTS` or `INVALID_TIME_RANGE`"),
            @ApiResponse(responseCode = "404", description = "`VENUE_NOT_FOUND`")
    })
    @PostMapping
    public ResponseEntity<EventResponse> create(@Valid @RequestBody CreateEventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(eventService.createEvent(request));
    }

    @Operation(summary = "List events", description = "Non-admin callers only see published events.")
    @GetMapping
    public ResponseEntity<List<EventResponse>> list(
            @RequestParam(name = "status", required = false) EventStatus status,
            @RequestParam(name = "published", required = false) Boolean published,
            @RequestParam(name = "venueId", required = false) Long venueId,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(eventService.listEvents(status, published, venueId, principal.isAdmin()));
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> get(
            @PathVariable("eventId") Long eventId,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        return ResponseEntity.ok(eventService.getEvent(eventId, principal.isAdmin()));
    }

    @Operation(
            summary = "Update an event (admin)",
            description = """
                    Partial update. Once an event is published or has confirmed registrations only \
                    `status` may change; other fields answer 409 `EVENT_LOCKED`.
                    """
    )
    @PutMapping("/{eventId}")
    public ResponseEntity<EventResponse> update(
            @PathVariable("eventId") Long eventId,
            @Valid @RequestBody UpdateEventRequest request
    ) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        return ResponseEntity.ok(eventService.updateEvent(eventId, request));
    }

    @Operation(summary = "Delete an event without registrations (admin)")
    @DeleteMapping("/{eventId}")
    public ResponseEntity<Void> delete(@PathVariable("eventId") Long eventId) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        eventService.deleteEvent(eventId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{eventId}/publish")
    public ResponseEntity<EventResponse> publish(@PathVariable("eventId") Long eventId) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        return ResponseEntity.ok(eventService.publish(eventId));
    }

    @PostMapping("/{eventId}/unpublish")
    public ResponseEntity<EventResponse> unpublish(@PathVariable("eventId") Long eventId) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        return ResponseEntity.ok(eventService.unpublish(eventId));
    }
}
