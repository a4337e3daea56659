package io.github.drompincen.channelhub.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "channelhub")
public record ChannelHubProperties(
        String publicUrl,
        Crypto crypto,
        Channels channels,
        OAuth oauth,
        Slack slack,
        Discord discord,
        Teams teams,
        Agent agent,
        Models models
) {
    public ChannelHubProperties {
        if (publicUrl == null || publicUrl.isBlank()) publicUrl = "http://localhost:8080";
        if (publicUrl.endsWith("/")) publicUrl = publicUrl.substring(0, publicUrl.length() - 1);
        if (crypto == null) crypto = new Crypto(null);
        if (channels == null) channels = new Channels(true, null, null);
        if (oauth == null) oauth = new OAuth(null, null, null);
        if (slack == null) slack = new Slack(null, null, null, null);
        if (discord == null) discord = new Discord(null, null, null, null);
        if (teams == null) teams = new Teams(null, null, null, null);
        if (agent == null) agent = new Agent(null, null);
        if (models == null) models = new Models(null, null, null);
    }

    public static ChannelHubProperties defaults() {
        return new ChannelHubProperties(null, null, null, null, null, null, null, null, null);
    }

    public record Crypto(String encryptionKey) {}

    public record Channels(boolean autoStart, RateLimit rateLimit, Reconnect reconnect) {
        public Channels {
            if (rateLimit == null) rateLimit = new RateLimit(30, 60);
            if (reconnect == null) reconnect = new Reconnect(5, null, null);
        }
    }

    public record RateLimit(int limit, long windowSeconds) {}

    public record Reconnect(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        public Reconnect {
            if (maxAttempts <= 0) maxAttempts = 5;
            if (initialDelay == null) initialDelay = Duration.ofSeconds(1);
            if (maxDelay == null) maxDelay = Duration.ofSeconds(30);
        }
    }

    public record OAuth(Duration stateTtl, Duration refreshBuffer, Duration sweepInterval) {
        public OAuth {
            if (stateTtl == null) stateTtl = Duration.ofMinutes(10);
            if (refreshBuffer == null) refreshBuffer = Duration.ofMinutes(5);
            if (sweepInterval == null) sweepInterval = Duration.ofSeconds(60);
        }
    }

    /** {@code signingSecret} is the app-wide fallback for accounts that do not carry their own. */
    public record Slack(String clientId, String clientSecret, String signingSecret, String scopes) {
        public Slack {
            if (scopes == null || scopes.isBlank()) {
                scopes = "app_mentions:read,channels:history,channels:read,chat:write,im:history,im:read,im:write,users:read";
            }
        }
    }

    /** {@code botToken} is the application bot used for guilds installed through OAuth. */
    public record Discord(String clientId, String clientSecret, String botToken, String permissions) {
        public Discord {
            if (permissions == null || permissions.isBlank()) permissions = "274877975552";
        }
    }

    public record Teams(String appId, String appPassword, String tenantId, String openidJwksUri) {
        public Teams {
            if (openidJwksUri == null || openidJwksUri.isBlank()) {
                openidJwksUri = "https://login.botframework.com/v1/.well-known/keys";
            }
        }
    }

    public record Agent(String endpoint, Duration timeout) {
        public Agent {
            if (timeout == null) timeout = Duration.ofSeconds(120);
        }
    }

    /** Fallback model used when a tenant has no upstream key of its own. Keys map provider id to API key. */
    public record Models(String fallbackProvider, String fallbackModel, Map<String, String> keys) {
        public Models {
            if (keys == null) keys = Map.of();
        }
    }
}
