package com.campushub.backend.modules.registration.presentation;

import java.util.List;

import com.campushub.backend.global.security.JwtAuthenticationPrincipal;
import com.campushub.backend.modules.auth.application.UserInputValidator;
import com.campushub.backend.modules.registration.application.RegistrationService;
import com.campushub.backend.modules.registration.presentation.dto.EventRegistrationResponse;
import com.campushub.backend.modules.registration.presentation.dto.MyRegistrationResponse;
import com.campushub.backend.modules.registration.presentation.dto.RegistrationResponse;
import com.campushub.backend.modules.registration.presentation.dto.RegistrationStatsResponse;
import com.campushub.backend.modules.registration.presentation.dto.UpdateRegistrationStatusRequest;

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
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Registrations")
public class RegistrationController {

    private final RegistrationService registrationService;

    public RegistrationController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @Operation(
            summary = "Register for an event",
            description = """
                    Confirms the registration while the event has free slots, otherwise places it on the \
                    waitlist. The response `regStatus` is `CONFIRMED` or `WAITLISTED`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registration created"),
            @ApiResponse(responseCode = "404", description = "`EVENT_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`ALREADY_REGISTERED` or `EVENT_NOT_OPEN`")
    })
    @PostMapping("/events/{eventId}/registrations")
    public ResponseEntity<RegistrationResponse> register(
            @PathVariable("eventId") Long eventId,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.register(principal.userId(), eventId));
    }

    @Operation(
            summary = "Cancel a registration",
            description = """
                    Owner or admin. Cancelling a confirmed registration promotes the oldest waitlisted \
                    registration of the event when a slot is free.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Registration cancelled"),
            @ApiResponse(responseCode = "403", description = "`FORBIDDEN`"),
            @ApiResponse(responseCode = "404", description = "`REGISTRATION_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`ALREADY_CANCELLED` or `INVALID_STATUS_TRANSITION`")
    })
    @DeleteMapping("/events/{eventId}/registrations/{registrationId}")
    public ResponseEntity<RegistrationResponse> cancel(
            @PathVariable("eventId") Long eventId,
            @PathVariable("registrationId") Long registrationId,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        UserInputValidator.requirePositiveId(registrationId, "registrationId");
        return ResponseEntity.ok(registrationService.cancel(eventId, registrationId, principal.userId()));
    }

    @Operation(summary = "Change a registration status (admin)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "409", description = "`INVALID_STATUS_TRANSITION` or `CAPACITY_EXCEEDED`")
    })
    @PutMapping("/registrations/{registrationId}")
    public ResponseEntity<RegistrationResponse> updateStatus(
            @PathVariable("registrationId") Long registrationId,
            @Valid @RequestBody UpdateRegistrationStatusRequest request,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        UserInputValidator.requirePositiveId(registrationId, "registrationId");
        return ResponseEntity.ok(registrationService.updateStatus(
                registrationId, request.status(), request.reason(), principal.userId()));
    }

    @Operation(summary = "Registration counts by status (admin)")
    @GetMapping("/events/{eventId}/registrations/stats")
    public ResponseEntity<RegistrationStatsResponse> stats(@PathVariable("eventId") Long eventId) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        return ResponseEntity.ok(registrationService.getEventRegistrationStats(eventId));
    }

    @Operation(summary = "Registrations of an event with registrant details (admin)")
    @GetMapping("/events/{eventId}/registrations")
    public ResponseEntity<List<EventRegistrationResponse>> listForEvent(@PathVariable("eventId") Long eventId) {
        UserInputValidator.requirePositiveId(eventId, "eventId");
        return ResponseEntity.ok(registrationService.listEventRegistrations(eventId));
    }

    @Operation(summary = "Registrations of the authenticated user")
    @GetMapping("/registrations/me")
    public ResponseEntity<List<MyRegistrationResponse>> listMine(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(registrationService.listMyRegistrations(principal.userId()));
    }
}
