package com.campushub.backend.global.security;

import java.util.List;

public record JwtAuthenticationPrincipal(Long userId, String email, List<String> roles) {

    public boolean isAdmin() {
        return roles != null && roles.contains(SecurityUtils.ROLE_ADMIN);
    }
}
