package com.campushub.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * HTTP 상태와 함께 고정된 오류 코드를 전달하는 비즈니스 예외.
 * {@link RestExceptionHandler}가 {@code application/problem+json}으로 변환한다.
 */
public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:campushub:";

    private final String code;
    private final String detail;
    private final String type;
    private final Map<String, Object> properties;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, Map.of());
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, Map.of());
    }

    public ProblemException(HttpStatus status, String code, String detail, Map<String, Object> properties) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
        this.properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static ProblemException badRequest(String code, String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, code, detail);
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(HttpStatus.NOT_FOUND, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(HttpStatus.CONFLICT, code, detail);
    }

    public static ProblemException forbidden(String code, String detail) {
        return new ProblemException(HttpStatus.FORBIDDEN, code, detail);
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }
}
