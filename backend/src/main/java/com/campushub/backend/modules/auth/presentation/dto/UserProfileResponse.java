package com.campushub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record UserProfileResponse(
        Long userId,
        String studentId,
        String username,
        String fullName,
        String email,
        String phone,
        Long branchId,
        String branchName,
        int graduationYear,
        String status,
        List<String> roles,
        boolean isAdmin,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
