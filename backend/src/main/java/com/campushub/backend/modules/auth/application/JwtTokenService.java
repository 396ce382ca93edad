package com.campushub.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;

import javax.crypto.SecretKey;

import com.campushub.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.campushub.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public TokenPairResponse issueTokenPair(Long userId, String email, List<String> roles, String refreshToken) {
        Instant now = clock.instant();
        SecretKey key = tokenProvider.getSecretKey();

        String accessToken = Jwts.builder()
                .subject(String.valueOf(userId))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLES, roles)
                .signWith(key, SIG.HS256)
                .compact();

        return TokenPairResponse.bearer(
                accessToken,
                accessTokenTtlMillis,
                refreshToken,
                refreshTokenTtlMillis,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long userId = Long.valueOf(claims.getSubject());
            String email = claims.get(CLAIM_EMAIL, String.class);
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    email,
                    roles,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    public record ParsedToken(Long userId, String email, List<String> roles, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
