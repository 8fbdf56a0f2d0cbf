package com.fabric.runtime.api;

import com.fabric.shared.error.AuthorizationException;
import com.fabric.shared.error.ErrorCode;
import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.error.PlatformException;
import com.fabric.shared.error.TransientInfraException;
import com.fabric.shared.error.ValidationException;
import com.fabric.shared.error.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;

/**
 * Maps platform exceptions to RFC 7807 {@link ProblemDetail} bodies.
 *
 *   ValidationException, malformed request  → 400
 *   AuthorizationException                  → 403
 *   NotFoundException                       → 404
 *   VersionConflictException                → 409
 *   TransientInfraException                 → 503
 *   anything else                           → 500, no internal detail
 *
 * Execution-time failures never reach this handler; they are visible through execution status.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ProblemDetail handleValidation(ValidationException ex) {
        log.warn("Request rejected: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), ex.getCode());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            ServletRequestBindingException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), ErrorCode.VALIDATION);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", detail, ErrorCode.VALIDATION);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ProblemDetail handleAuthorization(AuthorizationException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), ex.getCode());
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), ex.getCode());
    }

    @ExceptionHandler(VersionConflictException.class)
    public ProblemDetail handleConflict(VersionConflictException ex) {
        log.info("Version conflict: key={}, expected={}, actual={}",
                ex.getKey(), ex.getExpectedVersion(), ex.getActualVersion());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Version Conflict",
                "The record changed since it was read; re-read and retry", ex.getCode());
        problem.setProperty("expected_version", ex.getExpectedVersion());
        problem.setProperty("actual_version", ex.getActualVersion());
        return problem;
    }

    @ExceptionHandler(TransientInfraException.class)
    public ProblemDetail handleTransient(TransientInfraException ex) {
        log.error("Storage unavailable after retries", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "Storage is temporarily unavailable", ex.getCode());
    }

    @ExceptionHandler(PlatformException.class)
    public ProblemDetail handlePlatform(PlatformException ex) {
        log.error("Unhandled platform error: code={}", ex.getCode(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", ex.getCode());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, ErrorCode code) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        if (code != null) {
            problem.setType(URI.create("urn:execution-core:error:" + code.name().toLowerCase(Locale.ROOT)));
            problem.setProperty("code", code.name());
        }
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
