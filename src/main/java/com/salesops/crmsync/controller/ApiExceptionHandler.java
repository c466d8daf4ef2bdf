package com.salesops.crmsync.controller;

import com.salesops.crmsync.exception.AuthenticationException;
import com.salesops.crmsync.exception.BackupInProgressException;
import com.salesops.crmsync.exception.CircuitOpenException;
import com.salesops.crmsync.exception.IntegrityException;
import com.salesops.crmsync.exception.NotFoundException;
import com.salesops.crmsync.exception.PayloadValidationException;
import com.salesops.crmsync.exception.PermanentException;
import com.salesops.crmsync.exception.RateLimitExceededException;
import com.salesops.crmsync.exception.RemoteUnavailableException;
import com.salesops.crmsync.exception.SyncInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps the service's exceptions onto HTTP statuses as RFC 7807 problem details.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AuthenticationException.class)
    public ProblemDetail handleAuthentication(AuthenticationException ex) {
        log.warn("Rejected unauthenticated request: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage());
    }

    @ExceptionHandler({PayloadValidationException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleRateLimit(RateLimitExceededException ex) {
        long seconds = Math.max(1, (ex.getRetryAfter().toMillis() + 999) / 1000);
        log.warn("Rate limit exceeded, retry after {}s: {}", seconds, ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", ex.getMessage());
        problem.setProperty("retryAfterSeconds", seconds);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                .body(problem);
    }

    @ExceptionHandler({CircuitOpenException.class, RemoteUnavailableException.class})
    public ProblemDetail handleRemoteUnavailable(RuntimeException ex) {
        log.warn("CRM unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage());
    }

    @ExceptionHandler({SyncInProgressException.class, BackupInProgressException.class})
    public ProblemDetail handleInProgress(RuntimeException ex) {
        log.info("Rejected overlapping operation: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
    }

    @ExceptionHandler(IntegrityException.class)
    public ProblemDetail handleIntegrity(IntegrityException ex) {
        log.error("Backup integrity check failed: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Integrity Check Failed", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    @ExceptionHandler(PermanentException.class)
    public ProblemDetail handlePermanent(PermanentException ex) {
        log.error("CRM rejected the request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "CRM Rejected Request", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("❌ Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
