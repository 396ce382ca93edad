package com.campushub.backend.modules.event.presentation;

import java.util.List;

import com.campushub.backend.modules.auth.application.UserInputValidator;
import com.campushub.backend.modules.event.application.VenueService;
import com.campushub.backend.modules.event.presentation.dto.UpdateVenueRequest;
import com.campushub.backend.modules.event.presentation.dto.VenueRequest;
import com.campushub.backend.modules.event.presentation.dto.VenueResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/venues")
@Tag(name = "Venues")
public class VenueController {

    private final VenueService venueService;

    public VenueController(VenueService venueService) {
        this.venueService = venueService;
    }

    @GetMapping
    public ResponseEntity<List<VenueResponse>> list() {
        return ResponseEntity.ok(venueService.listVenues());
    }

    @GetMapping("/{venueId}")
    public ResponseEntity<VenueResponse> get(@PathVariable("venueId") Long venueId) {
        UserInputValidator.requirePositiveId(venueId, "venueId");
        return ResponseEntity.ok(venueService.getVenue(venueId));
    }

    @Operation(summary = "Create a venue (admin)")
    @PostMapping
    public ResponseEntity<VenueResponse> create(@Valid @RequestBody VenueRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(venueService.createVenue(request));
    }

    @Operation(
            summary = "Update a venue (admin)",
            description = "Capacity cannot drop below the slot count of an event held at the venue."
    )
    @PutMapping("/{venueId}")
    public ResponseEntity<VenueResponse> update(
            @PathVariable("venueId") Long venueId,
            @Valid @RequestBody UpdateVenueRequest request
    ) {
        UserInputValidator.requirePositiveId(venueId, "venueId");
        return ResponseEntity.ok(venueService.updateVenue(venueId, request));
    }
}
