/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api;

import com.genesisrelay.application.resilience.CircuitOpenException;
import com.genesisrelay.application.routing.ExhaustedFallbackException;
import com.genesisrelay.application.sources.ConfigurationException;
import com.genesisrelay.application.sources.DependencyException;
import com.genesisrelay.application.sources.InvalidDescriptorException;
import com.genesisrelay.application.sources.RateLimitExceededException;
import com.genesisrelay.config.RequestIdFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Duration;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ApiErrorResponse> handleCircuitOpen(CircuitOpenException ex) {
        Duration wait = ex.getNextAttemptTime() == null
                ? Duration.ZERO
                : Duration.between(clock.instant(), ex.getNextAttemptTime());
        return withRetryAfter(respond(HttpStatus.SERVICE_UNAVAILABLE, "CIRCUIT_OPEN", ex.getMessage()), wait);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimit(RateLimitExceededException ex) {
        return withRetryAfter(respond(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", ex.getMessage()), ex.getRetryAfter());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiErrorResponse> handleConfiguration(ConfigurationException ex) {
        return respond(HttpStatus.NOT_FOUND, "SOURCE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(DependencyException.class)
    public ResponseEntity<ApiErrorResponse> handleDependency(DependencyException ex) {
        log.warn("Dependency failure source={} status={}", ex.getSourceId(), ex.getStatus());
        return respond(HttpStatus.BAD_GATEWAY, "DEPENDENCY_ERROR", ex.getMessage());
    }

    @ExceptionHandler(ExhaustedFallbackException.class)
    public ResponseEntity<ApiErrorResponse> handleExhausted(ExhaustedFallbackException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "EXHAUSTED_FALLBACK",
                "All AI providers are temporarily unavailable. Please try again shortly.");
    }

    @ExceptionHandler(InvalidDescriptorException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidDescriptor(InvalidDescriptorException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_DESCRIPTOR", String.join("; ", ex.getErrors()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    /**
     * Framework errors (unknown path, wrong method, ...) keep their own status.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.resolve(framework.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return respond(status, status.name(), status.getReasonPhrase());
            }
        }
        return internal(ex);
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                RequestIdFilter.currentRequestId()
        );
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ApiErrorResponse> withRetryAfter(ResponseEntity<ApiErrorResponse> response, Duration wait) {
        long seconds = Math.max(1, (wait.toMillis() + 999) / 1000);
        return ResponseEntity.status(response.getStatusCode())
                .header(HttpHeaders.RETRY_AFTER, Long.toString(seconds))
                .body(response.getBody());
    }

    private ResponseEntity<ApiErrorResponse> internal(Exception ex) {
        log.error("Unhandled exception requestId={}", RequestIdFilter.currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }
}
