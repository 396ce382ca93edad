package com.campushub.backend.global.error;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    private static final String GENERIC_SERVER_DETAIL = "The request could not be completed. Please retry later.";

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        ProblemResponse body = ProblemResponse.of(
                status,
                ex.getCode(),
                ex.getDetailMessage(),
                request.getRequestURI(),
                ex.getProperties()
        );
        return respond(status, body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(
            ResponseStatusException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, "VALIDATION_ERROR", detail, request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ProblemResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        String detail = ex instanceof MethodArgumentTypeMismatchException mismatch
                ? mismatch.getName() + " has an invalid value"
                : "Malformed request";
        ProblemResponse body = ProblemResponse.of(status, "INVALID_INPUT", detail, request.getRequestURI());
        return respond(status, body);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.FORBIDDEN;
        ProblemResponse body = ProblemResponse.of(
                status,
                "FORBIDDEN",
                "You do not have permission to access this resource",
                request.getRequestURI()
        );
        return respond(status, body);
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ProblemResponse> handleLockFailure(
            PessimisticLockingFailureException ex,
            HttpServletRequest request
    ) {
        log.warn("Lock acquisition failed for {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return serverError("TRANSACTION_FAILED", request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Persistence failure for {}", request.getRequestURI(), ex);
        return serverError("TRANSACTION_FAILED", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            HttpStatus status = resolveStatus(errorResponse.getStatusCode());
            String code = status.name();
            ProblemResponse body = ProblemResponse.of(status, code, status.getReasonPhrase(), request.getRequestURI());
            return respond(status, body);
        }
        log.error("Unhandled exception for {}", request.getRequestURI(), ex);
        return serverError("INTERNAL_ERROR", request);
    }

    private ResponseEntity<ProblemResponse> serverError(String code, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, code, GENERIC_SERVER_DETAIL, request.getRequestURI());
        return respond(status, body);
    }

    private ResponseEntity<ProblemResponse> respond(HttpStatus status, ProblemResponse body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(body);
    }

    private HttpStatus resolveStatus(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
    }
}
