package com.campushub.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 생존({@code /healthz}, {@code /health}) 및 준비({@code /readyz}) 상태 확인 엔드포인트.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    /**
     * 데이터베이스 헬스 인디케이터가 UP이면 준비 완료, 아니면 503을 반환한다.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent health = healthEndpoint.health();
            status = health.getStatus().getCode();
            if (health instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed", ex);
            status = Status.DOWN.getCode();
        }
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, Instant.now(clock).toString()));
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
