package io.github.drompincen.channelhub.persistence.store;

import java.time.Instant;
import java.util.Map;

/**
 * Values written by an upsert. Tokens are already vault blobs; a null token clears the stored one,
 * matching "replace credentials" semantics on a colliding key.
 */
public record AccountFields(
        String accountId,
        String accessToken,
        String refreshToken,
        Instant tokenExpiresAt,
        Map<String, Object> config,
        String displayName,
        boolean active
) {}
