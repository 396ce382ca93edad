package com.campushub.backend.modules.auth.presentation;

import com.campushub.backend.modules.auth.application.AuthService;
import com.campushub.backend.modules.auth.presentation.dto.LoginRequest;
import com.campushub.backend.modules.auth.presentation.dto.LoginResponse;
import com.campushub.backend.modules.auth.presentation.dto.LogoutRequest;
import com.campushub.backend.modules.auth.presentation.dto.RefreshRequest;
import com.campushub.backend.modules.auth.presentation.dto.SignupRequest;
import com.campushub.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/signup")
    @Operation(summary = "Create a student account")
    public ResponseEntity<UserProfileResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.signup(request));
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Log in with email and password")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/auth/refresh")
    @Operation(summary = "Rotate a refresh token")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/auth/logout")
    @Operation(summary = "Revoke a refresh token", description = "`allDevices: true` revokes every active session of the token owner.")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }
}
