package com.campushub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param allDevices {@code true}이면 토큰 소유자의 활성 세션을 모두 폐기한다
 */
public record LogoutRequest(
        @NotBlank(message = "refreshToken is required") String refreshToken,
        Boolean allDevices
) {

    public boolean revokeAllDevices() {
        return Boolean.TRUE.equals(allDevices);
    }
}
