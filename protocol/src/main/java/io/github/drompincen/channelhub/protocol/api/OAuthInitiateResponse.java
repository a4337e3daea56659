package io.github.drompincen.channelhub.protocol.api;

public record OAuthInitiateResponse(
        String authUrl,
        String state
) {}
