package io.github.drompincen.channelhub.runtime.connector.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.connector.MessageSplitter;
import io.github.drompincen.channelhub.runtime.connector.ReconnectBackoff;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Discord bot over the gateway WebSocket (identify, heartbeat, resume) with REST for sending.
 * A dropped gateway is reopened with bounded backoff; once attempts run out the listener is told.
 */
public class DiscordConnector implements ChannelConnector, OAuthCapable {

    private static final Logger log = LoggerFactory.getLogger(DiscordConnector.class);

    static final int MAX_MESSAGE_LENGTH = 2000;
    // GUILDS | GUILD_MESSAGES | DIRECT_MESSAGES | MESSAGE_CONTENT
    static final int INTENTS = 1 | 1 << 9 | 1 << 12 | 1 << 15;
    private static final Duration READY_TIMEOUT = Duration.ofSeconds(30);

    private final RestClient rest;
    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final ChannelHubProperties.Discord discord;
    private final ChannelHubProperties.Reconnect reconnect;
    private final String apiBase;
    private final String gatewayUrl;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> heartbeat;
    private volatile WebSocketSession session;
    private volatile CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile ConnectorListener listener;
    private volatile String botToken;
    private volatile String botUserId;
    private volatile String sessionId;
    private volatile Long sequence;
    private ReconnectBackoff backoff;

    public DiscordConnector(RestClient.Builder builder, WebSocketClient webSocketClient, ObjectMapper objectMapper,
                            ChannelHubProperties.Discord discord, ChannelHubProperties.Reconnect reconnect,
                            String apiBase, String gatewayUrl, Clock clock) {
        this.rest = builder.build();
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.discord = discord;
        this.reconnect = reconnect;
        this.apiBase = apiBase;
        this.gatewayUrl = gatewayUrl;
        this.clock = clock;
    }

    @Override
    public ChannelType type() {
        return ChannelType.DISCORD;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        String token = "oauth".equals(config.setting("installedVia")) ? discord.botToken() : config.accessToken();
        if (token == null || token.isBlank()) {
            throw new CredentialMissingException("Discord bot token is missing");
        }
        this.botToken = token;
        this.listener = listener;

        JsonNode me;
        try {
            me = rest.get().uri(apiBase + "/users/@me")
                    .header("Authorization", "Bot " + token)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RuntimeException e) {
            throw new ConnectorConnectException("Discord rejected the bot token: " + e.getMessage());
        }
        botUserId = me != null ? me.path("id").asText(null) : null;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "discord-gateway");
            t.setDaemon(true);
            return t;
        });
        backoff = new ReconnectBackoff(reconnect);
        running.set(true);
        cancellation.onCancel(() -> running.set(false));

        try {
            openGateway();
            ready.get(READY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disconnect();
            throw new ConnectorConnectException("Interrupted while waiting for Discord READY");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            disconnect();
            throw new ConnectorConnectException("Discord gateway did not become ready: " + describe(e));
        }
        String username = me != null ? me.path("username").asText(null) : null;
        log.info("Discord bot {} connected", username);
        return new ConnectResult(botUserId, username);
    }

    @Override
    public void disconnect() {
        running.set(false);
        cancelHeartbeat();
        ScheduledExecutorService s = scheduler;
        scheduler = null;
        if (s != null) {
            s.shutdownNow();
        }
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Closing Discord gateway failed: {}", e.getMessage());
            }
        }
        log.info("Discord connector stopped");
    }

    @Override
    public boolean isConnected() {
        WebSocketSession current = session;
        return running.get() && current != null && current.isOpen();
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        String token = botToken;
        if (token == null || !running.get()) {
            throw new DeliveryException("Discord connector is not connected");
        }
        List<String> chunks = MessageSplitter.split(content, MAX_MESSAGE_LENGTH);
        String lastId = null;
        for (int i = 0; i < chunks.size(); i++) {
            Map<String, Object> body = new HashMap<>();
            body.put("content", chunks.get(i));
            if (i == 0 && options.replyToId() != null) {
                body.put("message_reference", Map.of("message_id", options.replyToId(), "fail_if_not_exists", false));
            }
            try {
                JsonNode sent = rest.post()
                        .uri(apiBase + "/channels/{channelId}/messages", targetId)
                        .header("Authorization", "Bot " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(body)
                        .retrieve()
                        .body(JsonNode.class);
                lastId = sent != null ? sent.path("id").asText(null) : null;
            } catch (RuntimeException e) {
                throw new DeliveryException("Discord send failed: " + e.getMessage());
            }
        }
        return lastId;
    }

    // ---- gateway ----

    private void openGateway() {
        webSocketClient.execute(new GatewayHandler(), gatewayUrl)
                .whenComplete((opened, error) -> {
                    if (error == null) {
                        return;
                    }
                    log.warn("Discord gateway handshake failed: {}", error.getMessage());
                    // the first handshake fails connect outright; later ones go through backoff
                    if (!ready.isDone()) {
                        ready.completeExceptionally(error);
                    } else {
                        scheduleReconnect();
                    }
                });
    }

    void handleFrame(JsonNode frame, WebSocketSession ws) throws IOException {
        if (frame.hasNonNull("s")) {
            sequence = frame.path("s").asLong();
        }
        int op = frame.path("op").asInt(-1);
        switch (op) {
            case 10 -> {
                long interval = frame.path("d").path("heartbeat_interval").asLong(41_250);
                startHeartbeat(ws, interval);
                if (sessionId != null) {
                    sendFrame(ws, 6, Map.of("token", botToken, "session_id", sessionId, "seq", sequence == null ? 0 : sequence));
                } else {
                    sendFrame(ws, 2, identify());
                }
            }
            case 1 -> sendFrame(ws, 1, sequence);
            case 11 -> log.trace("Discord heartbeat acknowledged");
            case 7 -> {
                log.info("Discord asked for a reconnect");
                ws.close(CloseStatus.SERVICE_RESTARTED);
            }
            case 9 -> {
                if (!frame.path("d").asBoolean(false)) {
                    sessionId = null;
                    sequence = null;
                }
                ws.close(CloseStatus.SERVICE_RESTARTED);
            }
            case 0 -> handleDispatch(frame.path("t").asText(), frame.path("d"));
            default -> log.debug("Unhandled Discord gateway op {}", op);
        }
    }

    private void handleDispatch(String event, JsonNode data) {
        switch (event) {
            case "READY" -> {
                sessionId = data.path("session_id").asText(null);
                botUserId = data.path("user").path("id").asText(botUserId);
                if (backoff != null) {
                    backoff.reset();
                }
                ready.complete(null);
                log.info("Discord gateway ready, session {}", sessionId);
            }
            case "RESUMED" -> {
                if (backoff != null) {
                    backoff.reset();
                }
                log.info("Discord gateway session resumed");
            }
            case "MESSAGE_CREATE" -> handleMessageCreate(data);
            default -> log.trace("Discord dispatch {}", event);
        }
    }

    void handleMessageCreate(JsonNode data) {
        JsonNode author = data.path("author");
        if (author.path("bot").asBoolean(false) || author.path("id").asText("").equals(botUserId)) {
            return;
        }
        ConnectorListener current = listener;
        String content = data.path("content").asText("");
        List<ChannelAttachment> attachments = new ArrayList<>();
        for (JsonNode att : data.path("attachments")) {
            String mime = att.path("content_type").asText("");
            attachments.add(new ChannelAttachment(mime.startsWith("image/") ? "image" : "file",
                    att.path("url").asText(), att.path("filename").asText("attachment"),
                    att.path("size").asLong(0), mime));
        }
        if (current == null || (content.isBlank() && attachments.isEmpty())) {
            return;
        }
        String name = author.path("global_name").asText("");
        if (name.isEmpty()) {
            name = author.path("username").asText("Unknown");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (data.hasNonNull("guild_id")) {
            metadata.put("guildId", data.path("guild_id").asText());
        }
        ChannelMessage.ContentType contentType = attachments.isEmpty() ? ChannelMessage.ContentType.TEXT
                : "image".equals(attachments.get(0).type()) ? ChannelMessage.ContentType.IMAGE
                : ChannelMessage.ContentType.FILE;
        current.onMessage(new ChannelMessage(
                data.path("id").asText(),
                ChannelType.DISCORD,
                data.path("channel_id").asText(),
                null,
                content,
                contentType,
                attachments,
                author.path("id").asText("unknown"),
                name,
                parseTimestamp(data.path("timestamp").asText(null)),
                data.path("message_reference").path("message_id").asText(null),
                metadata));
    }

    private Map<String, Object> identify() {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("token", botToken);
        d.put("intents", INTENTS);
        d.put("properties", Map.of("os", "linux", "browser", "channelhub", "device", "channelhub"));
        return d;
    }

    private void startHeartbeat(WebSocketSession ws, long intervalMs) {
        cancelHeartbeat();
        ScheduledExecutorService s = scheduler;
        if (s == null) return;
        heartbeat = s.scheduleAtFixedRate(() -> {
            try {
                sendFrame(ws, 1, sequence);
            } catch (IOException e) {
                log.warn("Discord heartbeat failed: {}", e.getMessage());
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void cancelHeartbeat() {
        ScheduledFuture<?> h = heartbeat;
        heartbeat = null;
        if (h != null) {
            h.cancel(false);
        }
    }

    private void scheduleReconnect() {
        ScheduledExecutorService s = scheduler;
        if (!running.get() || s == null || s.isShutdown()) {
            return;
        }
        if (backoff.exhausted()) {
            running.set(false);
            log.error("Discord gateway lost after {} reconnect attempts", backoff.attempts());
            ConnectorListener current = listener;
            if (current != null) {
                current.onError(new ConnectorConnectException(
                        "Discord gateway lost after " + backoff.attempts() + " reconnect attempts"));
            }
            return;
        }
        Duration delay = backoff.nextDelay();
        log.info("Reconnecting to Discord gateway in {} ms (attempt {})", delay.toMillis(), backoff.attempts());
        s.schedule(this::openGateway, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void sendFrame(WebSocketSession ws, int op, Object d) throws IOException {
        Map<String, Object> frame = new HashMap<>();
        frame.put("op", op);
        frame.put("d", d);
        String json = objectMapper.writeValueAsString(frame);
        synchronized (ws) {
            ws.sendMessage(new TextMessage(json));
        }
    }

    private class GatewayHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession ws) {
            session = ws;
            log.debug("Discord gateway socket open");
        }

        @Override
        protected void handleTextMessage(WebSocketSession ws, TextMessage message) throws Exception {
            handleFrame(objectMapper.readTree(message.getPayload()), ws);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
            cancelHeartbeat();
            if (session == ws) {
                session = null;
            }
            log.warn("Discord gateway closed: {}", status);
            scheduleReconnect();
        }
    }

    // ---- oauth ----

    @Override
    public String authorizationUrl(String state, String redirectUri) {
        if (discord.clientId() == null) {
            throw new CredentialMissingException("Discord OAuth client is not configured");
        }
        return UriComponentsBuilder.fromHttpUrl("https://discord.com/api/oauth2/authorize")
                .queryParam("client_id", discord.clientId())
                .queryParam("permissions", discord.permissions())
                .queryParam("scope", "bot applications.commands")
                .queryParam("redirect_uri", redirectUri)
                .queryParam("state", state)
                .queryParam("response_type", "code")
                .encode()
                .toUriString();
    }

    @Override
    public OAuthCredentials exchangeCode(String code, String redirectUri) {
        MultiValueMap<String, String> form = clientForm();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        JsonNode data = token(form);
        JsonNode guild = data.path("guild");
        Map<String, Object> settings = new HashMap<>();
        settings.put("installedVia", "oauth");
        if (guild.hasNonNull("id")) {
            settings.put("guildId", guild.path("id").asText());
            settings.put("guildName", guild.path("name").asText(""));
        }
        return new OAuthCredentials(data.path("access_token").asText(), data.path("refresh_token").asText(null),
                expiry(data), guild.path("id").asText(null), null, guild.path("name").asText(null), settings);
    }

    @Override
    public OAuthCredentials refresh(String refreshToken) {
        MultiValueMap<String, String> form = clientForm();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        JsonNode data = token(form);
        return new OAuthCredentials(data.path("access_token").asText(), data.path("refresh_token").asText(null),
                expiry(data), null, null, null, Map.of());
    }

    private JsonNode token(MultiValueMap<String, String> form) {
        JsonNode data = rest.post()
                .uri(apiBase + "/oauth2/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
        if (data == null || !data.hasNonNull("access_token")) {
            throw new ConnectorConnectException("Discord OAuth failed: "
                    + (data == null ? "empty response" : data.path("error").asText("no_token")));
        }
        return data;
    }

    private MultiValueMap<String, String> clientForm() {
        if (discord.clientId() == null || discord.clientSecret() == null) {
            throw new CredentialMissingException("Discord OAuth client is not configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", discord.clientId());
        form.add("client_secret", discord.clientSecret());
        return form;
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

    private static String describe(Throwable e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
