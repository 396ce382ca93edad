package com.campushub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

/**
 * 액세스/리프레시 토큰 쌍. 만료 시간은 초 단위다.
 */
public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse bearer(
            String accessToken,
            long accessTtlMillis,
            String refreshToken,
            long refreshTtlMillis,
            OffsetDateTime issuedAt
    ) {
        return new TokenPairResponse(
                accessToken,
                DEFAULT_TOKEN_TYPE,
                accessTtlMillis / 1000L,
                refreshToken,
                refreshTtlMillis / 1000L,
                issuedAt
        );
    }

    public OffsetDateTime refreshExpiresAt() {
        return issuedAt.plusSeconds(refreshExpiresIn);
    }
}
