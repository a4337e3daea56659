package io.github.drompincen.channelhub.protocol.api;

import java.time.Instant;
import java.util.Map;

/**
 * Public view of a stored channel account. Credentials never leave the store, so this
 * carries only whether a token is present.
 */
public record ChannelAccountDto(
        String id,
        String channelType,
        String channelId,
        String accountId,
        String displayName,
        boolean active,
        boolean hasAccessToken,
        Instant tokenExpiresAt,
        Map<String, Object> config,
        Instant lastSyncAt,
        Instant createdAt,
        Instant updatedAt
) {}
