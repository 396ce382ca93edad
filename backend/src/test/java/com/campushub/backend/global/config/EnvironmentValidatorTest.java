package com.campushub.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void validConfigurationHasNoProblems() {
        MockEnvironment environment = baseEnvironment();

        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void missingKeysAreReported() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", "a-sufficiently-long-secret-for-hmac-signing");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .contains("spring.datasource.url is missing", "jwt.expiration is missing",
                        "app.cors.allowed-origins is missing");
    }

    @Test
    void developmentSecretIsRejectedInProduction() {
        MockEnvironment environment = baseEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);
        environment.setActiveProfiles("prod");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret must be replaced with a random value in production");
    }

    @Test
    void shortSecretAndOutOfRangeExpirationAreReported() {
        MockEnvironment environment = baseEnvironment()
                .withProperty("jwt.secret", "short")
                .withProperty("jwt.expiration", "1000");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder(
                        "jwt.secret must be at least 32 characters",
                        "jwt.expiration must be between 300000 and 86400000 milliseconds"
                );
    }

    @Test
    void validateEnvironmentFailsFast() {
        MockEnvironment environment = baseEnvironment().withProperty("jwt.expiration", "soon");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be numeric");
    }

    private static MockEnvironment baseEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/campushub")
                .withProperty("jwt.secret", "a-sufficiently-long-secret-for-hmac-signing")
                .withProperty("jwt.expiration", "900000")
                .withProperty("app.cors.allowed-origins", "http://localhost:5173");
    }
}
