package io.github.drompincen.channelhub.runtime.channel;

import java.time.Instant;
import java.util.Map;

/**
 * Normalized result of a code exchange or token refresh.
 * {@code channelId}/{@code accountId} identify the installed workspace and bot when the platform reports them.
 */
public record OAuthCredentials(
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        String channelId,
        String accountId,
        String displayName,
        Map<String, Object> settings
) {
    public OAuthCredentials {
        settings = settings == null ? Map.of() : settings;
    }

    @Override
    public String toString() {
        return "OAuthCredentials[channelId=" + channelId + ", accountId=" + accountId
                + ", expiresAt=" + expiresAt + "]";
    }
}
