package com.campushub.backend.modules.admin.presentation;

import java.util.Locale;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.global.security.JwtAuthenticationPrincipal;
import com.campushub.backend.modules.admin.application.AdminUserService;
import com.campushub.backend.modules.admin.presentation.dto.UpdateUserStatusRequest;
import com.campushub.backend.modules.auth.application.UserInputValidator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin")
public class AdminUserController {

    private final AdminUserService adminUserService;

    public AdminUserController(AdminUserService adminUserService) {
        this.adminUserService = adminUserService;
    }

    @Operation(summary = "Deactivate a user account", description = "Only `INACTIVE` is supported.")
    @PatchMapping("/users/{userId}/status")
    public ResponseEntity<Void> updateUserStatus(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody UpdateUserStatusRequest request,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        UserInputValidator.requirePositiveId(userId, "userId");
        String normalized = request.status().trim().toUpperCase(Locale.ROOT);
        if (!"INACTIVE".equals(normalized)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_STATUS", "Only INACTIVE is supported");
        }
        adminUserService.deactivateUser(userId, principal.userId(), request.reason());
        return ResponseEntity.noContent().build();
    }
}
