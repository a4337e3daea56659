package io.github.drompincen.channelhub.runtime.connector.teams;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelAttachment;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnectionConfig;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnector;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.ConnectResult;
import io.github.drompincen.channelhub.runtime.channel.ConnectorListener;
import io.github.drompincen.channelhub.runtime.channel.OAuthCapable;
import io.github.drompincen.channelhub.runtime.channel.OAuthCredentials;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.channel.WebhookCapable;
import io.github.drompincen.channelhub.runtime.channel.WebhookRequest;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import io.github.drompincen.channelhub.runtime.error.UnauthorizedWebhookException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * Microsoft Teams through the Bot Framework. Activities arrive on the webhook route with a signed
 * bearer token; replies are posted to the conversation's {@code serviceUrl} using an app token from
 * the client-credentials grant, refreshed on a timer.
 */
public class TeamsConnector implements ChannelConnector, WebhookCapable, OAuthCapable {

    private static final Logger log = LoggerFactory.getLogger(TeamsConnector.class);

    static final String BOT_FRAMEWORK_SCOPE = "https://api.botframework.com/.default";
    static final Duration REFRESH_INTERVAL = Duration.ofMinutes(45);
    static final Duration EXPIRY_BUFFER = Duration.ofSeconds(300);

    private final RestClient rest;
    private final ChannelHubProperties.Teams teams;
    private final String loginBase;
    private final BiFunction<String, String, BotFrameworkTokenValidator> validatorFactory;
    private final Clock clock;
    private final Map<String, String> serviceUrls = new ConcurrentHashMap<>();

    private volatile String appId;
    private volatile String appPassword;
    private volatile String accessToken;
    private volatile Instant tokenExpiresAt = Instant.EPOCH;
    private volatile BotFrameworkTokenValidator validator;
    private volatile ConnectorListener listener;
    private volatile ScheduledExecutorService refresher;

    public TeamsConnector(RestClient.Builder builder, ChannelHubProperties.Teams teams, String loginBase,
                          BiFunction<String, String, BotFrameworkTokenValidator> validatorFactory, Clock clock) {
        this.rest = builder.build();
        this.teams = teams;
        this.loginBase = loginBase;
        this.validatorFactory = validatorFactory;
        this.clock = clock;
    }

    @Override
    public ChannelType type() {
        return ChannelType.TEAMS;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        String id = config.setting("appId", teams.appId());
        String password = config.setting("appPassword", teams.appPassword());
        if (id == null || password == null) {
            throw new CredentialMissingException("Teams app id and app password are required");
        }
        this.appId = id;
        this.appPassword = password;
        try {
            refreshAccessToken();
        } catch (RuntimeException e) {
            throw new ConnectorConnectException("Teams bot token request failed: " + e.getMessage());
        }
        this.validator = validatorFactory.apply(teams.openidJwksUri(), id);
        this.listener = listener;

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "teams-token-refresh");
            t.setDaemon(true);
            return t;
        });
        long interval = REFRESH_INTERVAL.toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                refreshAccessToken();
            } catch (RuntimeException e) {
                log.warn("Teams token refresh failed: {}", e.getMessage());
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        refresher = scheduler;

        log.info("Teams bot {} connected", id);
        return new ConnectResult(id, "Microsoft Teams");
    }

    @Override
    public void disconnect() {
        ScheduledExecutorService scheduler = refresher;
        refresher = null;
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        accessToken = null;
        listener = null;
        serviceUrls.clear();
        log.info("Teams connector stopped");
    }

    @Override
    public boolean isConnected() {
        return accessToken != null;
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        if (!isConnected()) {
            throw new DeliveryException("Teams connector is not connected");
        }
        String serviceUrl = serviceUrls.get(targetId);
        if (serviceUrl == null) {
            throw new DeliveryException("No service URL known for Teams conversation " + targetId);
        }
        ensureFreshToken();

        Map<String, Object> activity = new HashMap<>();
        activity.put("type", "message");
        activity.put("text", content);
        activity.put("textFormat", "markdown");
        if (options.replyToId() != null) {
            activity.put("replyToId", options.replyToId());
        }
        try {
            JsonNode response = rest.post()
                    .uri(serviceUrl + "/v3/conversations/{conversationId}/activities", targetId)
                    .header("Authorization", "Bearer " + accessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(activity)
                    .retrieve()
                    .body(JsonNode.class);
            return response != null ? response.path("id").asText(null) : null;
        } catch (RuntimeException e) {
            throw new DeliveryException("Teams send failed: " + e.getMessage());
        }
    }

    // ---- webhook ----

    @Override
    public boolean validateIncomingRequest(WebhookRequest request) {
        BotFrameworkTokenValidator current = validator;
        if (current == null) {
            return false;
        }
        try {
            current.validate(request.header("Authorization"));
            return true;
        } catch (UnauthorizedWebhookException e) {
            log.warn("Teams activity rejected: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void handleIncomingActivity(JsonNode activity) {
        String conversationId = activity.path("conversation").path("id").asText(null);
        String serviceUrl = activity.path("serviceUrl").asText(null);
        if (conversationId != null && serviceUrl != null) {
            serviceUrls.put(conversationId, stripSlash(serviceUrl));
        }
        String type = activity.path("type").asText();
        switch (type) {
            case "message" -> handleMessage(activity);
            case "conversationUpdate" -> log.info("Teams conversation update for {}", conversationId);
            case "messageUpdate", "messageDelete" -> log.debug("Teams {} for {} ignored", type, conversationId);
            default -> log.debug("Unhandled Teams activity type {}", type);
        }
    }

    private void handleMessage(JsonNode activity) {
        ConnectorListener current = listener;
        String text = activity.path("text").asText("");
        List<ChannelAttachment> attachments = new ArrayList<>();
        for (JsonNode att : activity.path("attachments")) {
            if (!att.hasNonNull("contentUrl")) continue;
            String mime = att.path("contentType").asText("");
            attachments.add(new ChannelAttachment(mime.startsWith("image/") ? "image" : "file",
                    att.path("contentUrl").asText(), att.path("name").asText("attachment"), 0, mime));
        }
        if (current == null || (text.isBlank() && attachments.isEmpty())) {
            return;
        }

        JsonNode channelData = activity.path("channelData");
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("serviceUrl", activity.path("serviceUrl").asText(""));
        metadata.put("tenantId", channelData.path("tenant").path("id")
                .asText(activity.path("conversation").path("tenantId").asText("")));
        metadata.put("teamId", channelData.path("team").path("id").asText(""));
        metadata.put("teamName", channelData.path("team").path("name").asText(""));
        metadata.put("isGroup", activity.path("conversation").path("isGroup").asBoolean(false));

        ChannelMessage.ContentType contentType = attachments.isEmpty() ? ChannelMessage.ContentType.TEXT
                : "image".equals(attachments.get(0).type()) ? ChannelMessage.ContentType.IMAGE
                : ChannelMessage.ContentType.FILE;
        current.onMessage(new ChannelMessage(
                activity.path("id").asText(),
                ChannelType.TEAMS,
                activity.path("conversation").path("id").asText(),
                null,
                text,
                contentType,
                attachments,
                activity.path("from").path("id").asText("unknown"),
                activity.path("from").path("name").asText("Unknown User"),
                parseTimestamp(activity.path("timestamp").asText(null)),
                activity.path("replyToId").asText(null),
                metadata));
    }

    // ---- oauth ----

    @Override
    public String authorizationUrl(String state, String redirectUri) {
        if (teams.appId() == null) {
            throw new CredentialMissingException("Teams app id is not configured");
        }
        return UriComponentsBuilder.fromHttpUrl(loginBase + "/" + tenantSegment() + "/oauth2/v2.0/authorize")
                .queryParam("client_id", teams.appId())
                .queryParam("response_type", "code")
                .queryParam("redirect_uri", redirectUri)
                .queryParam("scope", BOT_FRAMEWORK_SCOPE)
                .queryParam("state", state)
                .encode()
                .toUriString();
    }

    @Override
    public OAuthCredentials exchangeCode(String code, String redirectUri) {
        MultiValueMap<String, String> form = appForm();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        JsonNode data = token(loginBase + "/" + tenantSegment() + "/oauth2/v2.0/token", form);
        Map<String, Object> settings = new HashMap<>();
        settings.put("appId", teams.appId());
        if (teams.tenantId() != null) {
            settings.put("tenantId", teams.tenantId());
        }
        return new OAuthCredentials(data.path("access_token").asText(), data.path("refresh_token").asText(null),
                expiry(data), null, teams.appId(), null, settings);
    }

    @Override
    public OAuthCredentials refresh(String refreshToken) {
        MultiValueMap<String, String> form = appForm();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        JsonNode data = token(loginBase + "/" + tenantSegment() + "/oauth2/v2.0/token", form);
        return new OAuthCredentials(data.path("access_token").asText(), data.path("refresh_token").asText(null),
                expiry(data), null, null, null, Map.of());
    }

    // ---- token handling ----

    void refreshAccessToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", appId);
        form.add("client_secret", appPassword);
        form.add("scope", BOT_FRAMEWORK_SCOPE);
        JsonNode data = token(loginBase + "/botframework.com/oauth2/v2.0/token", form);
        accessToken = data.path("access_token").asText();
        tokenExpiresAt = clock.instant().plusSeconds(data.path("expires_in").asLong(3600));
        log.debug("Teams bot token refreshed, valid until {}", tokenExpiresAt);
    }

    private void ensureFreshToken() {
        if (clock.instant().plus(EXPIRY_BUFFER).isAfter(tokenExpiresAt)) {
            try {
                refreshAccessToken();
            } catch (RuntimeException e) {
                throw new DeliveryException("Teams bot token refresh failed: " + e.getMessage());
            }
        }
    }

    private JsonNode token(String url, MultiValueMap<String, String> form) {
        JsonNode data = rest.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
        if (data == null || data.hasNonNull("error") || !data.hasNonNull("access_token")) {
            String error = data == null ? "empty response"
                    : data.path("error").asText("no_token") + " " + data.path("error_description").asText("");
            throw new IllegalStateException(error.trim());
        }
        return data;
    }

    private MultiValueMap<String, String> appForm() {
        if (teams.appId() == null || teams.appPassword() == null) {
            throw new CredentialMissingException("Teams OAuth client is not configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", teams.appId());
        form.add("client_secret", teams.appPassword());
        form.add("scope", BOT_FRAMEWORK_SCOPE);
        return form;
    }

    private String tenantSegment() {
        return teams.tenantId() != null && !teams.tenantId().isBlank() ? teams.tenantId() : "common";
    }

    private Instant expiry(JsonNode data) {
        return data.hasNonNull("expires_in") ? clock.instant().plusSeconds(data.path("expires_in").asLong()) : null;
    }

    private static Instant parseTimestamp(String value) {
        try {
            return value != null ? Instant.parse(value) : Instant.now();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
