package io.github.drompincen.channelhub.gateway.controller;

import io.github.drompincen.channelhub.runtime.error.ChannelAlreadyConnectedException;
import io.github.drompincen.channelhub.runtime.error.ChannelNotFoundException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.RateLimitExceededException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void notFoundCarriesReason() {
        ResponseEntity<ApiExceptionHandler.ErrorResponse> response =
                handler.handleNotFound(ChannelNotFoundException.account("u1", "a1"));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody().code()).isEqualTo("not_found");
    }

    @Test
    void rateLimitSetsRetryAfter() {
        ResponseEntity<ApiExceptionHandler.ErrorResponse> response = handler.handleRateLimit(
                new RateLimitExceededException("Too many", Instant.now().plusSeconds(42)));

        assertThat(response.getStatusCode().value()).isEqualTo(429);
        long retryAfter = Long.parseLong(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        assertThat(retryAfter).isBetween(40L, 42L);
        assertThat(response.getBody().code()).isEqualTo("rate_limited");
    }

    @Test
    void credentialMissingIsUnprocessable() {
        assertThat(handler.handleCredentialMissing(new CredentialMissingException("Telegram bot token is not configured"))
                .getStatusCode().value()).isEqualTo(422);
    }

    @Test
    void alreadyConnectedIsConflict() {
        assertThat(handler.handleConflict(new ChannelAlreadyConnectedException("Signal number already linked"))
                .getStatusCode().value()).isEqualTo(409);
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<ApiExceptionHandler.ErrorResponse> response =
                handler.handle500(new NullPointerException("secret detail"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().message()).doesNotContain("secret detail");
    }
}
