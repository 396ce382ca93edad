package com.campushub.backend.modules.auth.presentation;

import com.campushub.backend.global.security.JwtAuthenticationPrincipal;
import com.campushub.backend.modules.auth.application.AuthService;
import com.campushub.backend.modules.auth.application.UserProfileService;
import com.campushub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.campushub.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Profile")
public class ProfileController {

    private final AuthService authService;
    private final UserProfileService userProfileService;

    public ProfileController(AuthService authService, UserProfileService userProfileService) {
        this.authService = authService;
        this.userProfileService = userProfileService;
    }

    @GetMapping("/profile/me")
    @Operation(summary = "Profile of the authenticated user")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }

    @GetMapping("/users/{userId}")
    @Operation(summary = "Profile of a user (owner or admin)")
    public ResponseEntity<UserProfileResponse> getUser(
            @PathVariable Long userId,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(userProfileService.getProfile(userId, principal));
    }

    @PutMapping("/users/{userId}")
    @Operation(summary = "Update own name, phone or password")
    public ResponseEntity<UserProfileResponse> updateUser(
            @PathVariable Long userId,
            @RequestBody UpdateProfileRequest request,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(userProfileService.updateProfile(userId, request, principal));
    }
}
