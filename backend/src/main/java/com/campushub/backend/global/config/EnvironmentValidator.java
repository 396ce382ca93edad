package com.campushub.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 기동 직후 필수 설정 값을 검사하고,
 * 누락되었거나 허용 범위를 벗어난 값이 있으면 즉시 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "campushub-dev-jwt-secret-change-me-before-deploying";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Environment configuration verified");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        boolean production = Arrays.asList(environment.getActiveProfiles()).contains("prod");
        if (production && jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret must be replaced with a random value in production");
        }
        if (jwtSecret.map(String::length).filter(length -> length < 32).isPresent()) {
            problems.add("jwt.secret must be at least 32 characters");
        }

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < 300000 || expiration > 86400000) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be numeric");
            }
        }
        return problems;
    }
}
