package io.github.drompincen.channelhub.runtime.connector.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Slack over the Events API. Slack pushes events to the webhook route; replies go out through
 * {@code chat.postMessage}. Workspaces are installed with OAuth v2.
 */
public class SlackConnector implements ChannelConnector, WebhookCapable, OAuthCapable {

    private static final Logger log = LoggerFactory.getLogger(SlackConnector.class);

    private final RestClient rest;
    private final String apiBase;
    private final ChannelHubProperties.Slack slack;
    private final Clock clock;
    private final Map<String, String> userNames = new ConcurrentHashMap<>();

    private volatile String botToken;
    private volatile String botUserId;
    private volatile SlackSignatureVerifier verifier;
    private volatile ConnectorListener listener;

    public SlackConnector(RestClient.Builder builder, ChannelHubProperties.Slack slack, String apiBase, Clock clock) {
        this.rest = builder.build();
        this.slack = slack;
        this.apiBase = apiBase;
        this.clock = clock;
    }

    @Override
    public ChannelType type() {
        return ChannelType.SLACK;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        if (config.accessToken() == null || config.accessToken().isBlank()) {
            throw new CredentialMissingException("Slack bot token is missing");
        }
        String signingSecret = config.setting("signingSecret", slack.signingSecret());
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new CredentialMissingException("Slack signing secret is missing");
        }

        JsonNode auth;
        try {
            auth = api("auth.test", config.accessToken(), Map.of());
        } catch (RuntimeException e) {
            throw new ConnectorConnectException("Slack auth.test failed: " + e.getMessage());
        }
        this.botToken = config.accessToken();
        this.botUserId = auth.path("user_id").asText(null);
        this.verifier = new SlackSignatureVerifier(signingSecret, clock);
        this.listener = listener;
        log.info("Slack bot {} ready for team {}", botUserId, auth.path("team").asText());
        return new ConnectResult(botUserId, auth.path("team").asText(null));
    }

    @Override
    public void disconnect() {
        botToken = null;
        listener = null;
        verifier = null;
        userNames.clear();
        log.info("Slack connector stopped");
    }

    @Override
    public boolean isConnected() {
        return botToken != null;
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        String token = botToken;
        if (token == null) {
            throw new DeliveryException("Slack connector is not connected");
        }
        Map<String, Object> body = new HashMap<>();
        body.put("channel", targetId);
        body.put("text", content);
        body.put("mrkdwn", true);
        if (options.threadId() != null) {
            body.put("thread_ts", options.threadId());
        }
        try {
            return api("chat.postMessage", token, body).path("ts").asText();
        } catch (RuntimeException e) {
            throw new DeliveryException("Slack chat.postMessage failed: " + e.getMessage());
        }
    }

    // ---- webhook ----

    @Override
    public boolean validateIncomingRequest(WebhookRequest request) {
        SlackSignatureVerifier current = verifier;
        return current != null && current.verify(request.header("X-Slack-Request-Timestamp"),
                request.header("X-Slack-Signature"), request.rawBody());
    }

    @Override
    public JsonNode handshakeResponse(JsonNode payload) {
        if (!"url_verification".equals(payload.path("type").asText())) {
            return null;
        }
        ObjectNode answer = JsonNodeFactory.instance.objectNode();
        answer.put("challenge", payload.path("challenge").asText());
        return answer;
    }

    @Override
    public void handleIncomingActivity(JsonNode payload) {
        if (!"event_callback".equals(payload.path("type").asText())) {
            log.debug("Ignoring Slack payload of type {}", payload.path("type").asText());
            return;
        }
        JsonNode event = payload.path("event");
        String eventType = event.path("type").asText();
        if (!"message".equals(eventType) && !"app_mention".equals(eventType)) {
            return;
        }
        // edits, deletes, joins and bot posts all carry a subtype
        if (event.hasNonNull("subtype") || event.hasNonNull("bot_id")) {
            return;
        }
        String user = event.path("user").asText(null);
        if (user == null || user.equals(botUserId)) {
            return;
        }
        ConnectorListener current = listener;
        if (current == null) {
            return;
        }

        List<ChannelAttachment> attachments = new ArrayList<>();
        for (JsonNode file : event.path("files")) {
            String mime = file.path("mimetype").asText("");
            attachments.add(new ChannelAttachment(mime.startsWith("image/") ? "image" : "file",
                    file.path("url_private").asText(), file.path("name").asText("file"),
                    file.path("size").asLong(0), mime));
        }
        String ts = event.path("ts").asText();
        ChannelMessage.ContentType contentType = attachments.isEmpty() ? ChannelMessage.ContentType.TEXT
                : "image".equals(attachments.get(0).type()) ? ChannelMessage.ContentType.IMAGE
                : ChannelMessage.ContentType.FILE;

        current.onMessage(new ChannelMessage(
                ts,
                ChannelType.SLACK,
                event.path("channel").asText(),
                event.path("thread_ts").asText(null),
                event.path("text").asText(""),
                contentType,
                attachments,
                user,
                userName(user),
                toInstant(ts),
                null,
                Map.of("teamId", payload.path("team_id").asText(""), "eventId", payload.path("event_id").asText(""))));
    }

    // ---- oauth ----

    @Override
    public String authorizationUrl(String state, String redirectUri) {
        requireClient();
        return UriComponentsBuilder.fromHttpUrl("https://slack.com/oauth/v2/authorize")
                .queryParam("client_id", slack.clientId())
                .queryParam("scope", slack.scopes())
                .queryParam("redirect_uri", redirectUri)
                .queryParam("state", state)
                .encode()
                .toUriString();
    }

    @Override
    public OAuthCredentials exchangeCode(String code, String redirectUri) {
        requireClient();
        MultiValueMap<String, String> form = clientForm();
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        JsonNode data = oauthAccess(form);
        return new OAuthCredentials(
                data.path("access_token").asText(),
                data.path("refresh_token").asText(null),
                expiry(data),
                data.path("team").path("id").asText(null),
                data.path("bot_user_id").asText(null),
                data.path("team").path("name").asText(null),
                Map.of("teamId", data.path("team").path("id").asText(""),
                        "teamName", data.path("team").path("name").asText("")));
    }

    @Override
    public OAuthCredentials refresh(String refreshToken) {
        requireClient();
        MultiValueMap<String, String> form = clientForm();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        JsonNode data = oauthAccess(form);
        return new OAuthCredentials(data.path("access_token").asText(), data.path("refresh_token").asText(null),
                expiry(data), null, null, null, Map.of());
    }

    private JsonNode oauthAccess(MultiValueMap<String, String> form) {
        JsonNode data = rest.post()
                .uri(apiBase + "/oauth.v2.access")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
        if (data == null || !data.path("ok").asBoolean(false)) {
            throw new ConnectorConnectException("Slack OAuth failed: "
                    + (data == null ? "empty response" : data.path("error").asText("unknown_error")));
        }
        return data;
    }

    private MultiValueMap<String, String> clientForm() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", slack.clientId());
        form.add("client_secret", slack.clientSecret());
        return form;
    }

    private void requireClient() {
        if (slack.clientId() == null || slack.clientSecret() == null) {
            throw new CredentialMissingException("Slack OAuth client is not configured");
        }
    }

    private Instant expiry(JsonNode data) {
        return data.hasNonNull("expires_in") ? clock.instant().plusSeconds(data.path("expires_in").asLong()) : null;
    }

    private String userName(String userId) {
        String cached = userNames.get(userId);
        if (cached != null) return cached;
        try {
            JsonNode user = rest.get()
                    .uri(apiBase + "/users.info?user={user}", userId)
                    .header("Authorization", "Bearer " + botToken)
                    .retrieve()
                    .body(JsonNode.class)
                    .path("user");
            String name = user.path("real_name").asText(user.path("name").asText("Unknown User"));
            userNames.put(userId, name);
            return name;
        } catch (RuntimeException e) {
            log.warn("Slack users.info failed for {}: {}", userId, e.getMessage());
            return "Unknown User";
        }
    }

    private JsonNode api(String method, String token, Map<String, Object> body) {
        JsonNode data = rest.post()
                .uri(apiBase + "/" + method)
                .header("Authorization", "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
        if (data == null || !data.path("ok").asBoolean(false)) {
            throw new IllegalStateException(data == null ? "empty response" : data.path("error").asText("unknown_error"));
        }
        return data;
    }

    private static Instant toInstant(String ts) {
        try {
            BigDecimal seconds = new BigDecimal(ts);
            return Instant.ofEpochMilli(seconds.movePointRight(3).longValue());
        } catch (NumberFormatException e) {
            return Instant.now();
        }
    }
}
