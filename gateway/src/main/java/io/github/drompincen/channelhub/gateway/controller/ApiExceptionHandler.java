package io.github.drompincen.channelhub.gateway.controller;

import io.github.drompincen.channelhub.runtime.error.ChannelAlreadyConnectedException;
import io.github.drompincen.channelhub.runtime.error.ChannelException;
import io.github.drompincen.channelhub.runtime.error.ChannelNotFoundException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.RateLimitExceededException;
import io.github.drompincen.channelhub.runtime.error.UnauthorizedWebhookException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Duration;
import java.time.Instant;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ChannelNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ChannelNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ChannelAlreadyConnectedException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ChannelAlreadyConnectedException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(CredentialMissingException.class)
    public ResponseEntity<ErrorResponse> handleCredentialMissing(CredentialMissingException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException e) {
        long retryAfter = e.resetAt() == null ? 60
                : Math.max(1, Duration.between(Instant.now(), e.resetAt()).toSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                .body(ErrorResponse.of(e.reason(), e.getMessage()));
    }

    @ExceptionHandler(UnauthorizedWebhookException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedWebhookException e) {
        log.warn("Rejected webhook: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of(e.reason(), "Unauthorized"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handle500(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("internal_error", "Unexpected error"));
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, ChannelException e) {
        return ResponseEntity.status(status).body(ErrorResponse.of(e.reason(), e.getMessage()));
    }

    public record ErrorResponse(String code, String message, Instant timestamp) {
        public static ErrorResponse of(String code, String message) {
            return new ErrorResponse(code, message, Instant.now());
        }
    }
}
