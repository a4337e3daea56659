package io.github.drompincen.channelhub.runtime.connector.matrix;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnectionConfig;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnector;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.ConnectResult;
import io.github.drompincen.channelhub.runtime.channel.ConnectorListener;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.connector.ReconnectBackoff;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Matrix client-server API: long-polls {@code /sync} and answers with {@code m.room.message}. The
 * first sync only records the position so history is not replayed.
 */
public class MatrixConnector implements ChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(MatrixConnector.class);

    private static final int SYNC_TIMEOUT_MS = 30_000;

    private final RestClient rest;
    private final ChannelHubProperties.Reconnect reconnect;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile String homeserver;
    private volatile String accessToken;
    private volatile String userId;
    private volatile ConnectorListener listener;
    private volatile Thread syncer;
    private volatile String since;

    public MatrixConnector(RestClient.Builder builder, ChannelHubProperties.Reconnect reconnect) {
        this.rest = builder.build();
        this.reconnect = reconnect;
    }

    @Override
    public ChannelType type() {
        return ChannelType.MATRIX;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        String server = config.setting("homeserverUrl");
        if (server == null || config.accessToken() == null) {
            throw new CredentialMissingException("Matrix homeserver URL and access token are required");
        }
        this.homeserver = server.endsWith("/") ? server.substring(0, server.length() - 1) : server;
        this.accessToken = config.accessToken();
        this.listener = listener;

        try {
            JsonNode whoami = get("/_matrix/client/v3/account/whoami", Map.of());
            userId = whoami.path("user_id").asText(config.setting("userId"));
            JsonNode initial = get("/_matrix/client/v3/sync?timeout=0", Map.of());
            since = initial.path("next_batch").asText(null);
        } catch (RuntimeException e) {
            throw new ConnectorConnectException("Matrix login check failed: " + e.getMessage());
        }

        running.set(true);
        cancellation.onCancel(() -> running.set(false));
        Thread thread = new Thread(this::syncLoop, "matrix-sync");
        thread.setDaemon(true);
        syncer = thread;
        thread.start();
        log.info("Matrix client {} syncing from {}", userId, homeserver);
        return new ConnectResult(userId, userId);
    }

    @Override
    public void disconnect() {
        running.set(false);
        Thread thread = syncer;
        syncer = null;
        if (thread != null) {
            thread.interrupt();
        }
        log.info("Matrix connector stopped");
    }

    @Override
    public boolean isConnected() {
        return running.get();
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        if (!isConnected()) {
            throw new DeliveryException("Matrix connector is not connected");
        }
        Map<String, Object> body = new HashMap<>();
        body.put("msgtype", "m.text");
        body.put("body", content);
        if (options.replyToId() != null) {
            body.put("m.relates_to", Map.of("m.in_reply_to", Map.of("event_id", options.replyToId())));
        }
        try {
            JsonNode response = rest.put()
                    .uri(homeserver + "/_matrix/client/v3/rooms/{roomId}/send/m.room.message/{txnId}",
                            targetId, UUID.randomUUID().toString())
                    .header("Authorization", "Bearer " + accessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            return response != null ? response.path("event_id").asText(null) : null;
        } catch (RuntimeException e) {
            throw new DeliveryException("Matrix send failed: " + e.getMessage());
        }
    }

    private void syncLoop() {
        ReconnectBackoff backoff = new ReconnectBackoff(reconnect);
        while (running.get()) {
            try {
                String path = "/_matrix/client/v3/sync?timeout=" + SYNC_TIMEOUT_MS + (since != null ? "&since={since}" : "");
                JsonNode sync = get(path, since != null ? Map.of("since", since) : Map.of());
                since = sync.path("next_batch").asText(since);
                backoff.reset();
                handleSync(sync);
            } catch (RuntimeException e) {
                if (!running.get()) break;
                log.warn("Matrix sync failed (attempt {}): {}", backoff.attempts() + 1, e.getMessage());
                if (backoff.exhausted()) {
                    running.set(false);
                    listener.onError(new ConnectorConnectException(
                            "Matrix sync gave up after " + backoff.attempts() + " attempts"));
                    break;
                }
                try {
                    Thread.sleep(backoff.nextDelay().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    void handleSync(JsonNode sync) {
        Iterator<Map.Entry<String, JsonNode>> rooms = sync.path("rooms").path("join").fields();
        while (rooms.hasNext()) {
            Map.Entry<String, JsonNode> room = rooms.next();
            for (JsonNode event : room.getValue().path("timeline").path("events")) {
                if (!"m.room.message".equals(event.path("type").asText())) continue;
                if (event.path("sender").asText("").equals(userId)) continue;
                JsonNode content = event.path("content");
                if (!"m.text".equals(content.path("msgtype").asText())) continue;

                try {
                    listener.onMessage(normalize(room.getKey(), event, content));
                } catch (RuntimeException e) {
                    log.error("Dropped Matrix event {}: {}", event.path("event_id").asText(), e.getMessage(), e);
                }
            }
        }
    }

    private ChannelMessage normalize(String roomId, JsonNode event, JsonNode content) {
        String sender = event.path("sender").asText();
        return new ChannelMessage(
                event.path("event_id").asText(),
                ChannelType.MATRIX,
                roomId,
                content.path("m.relates_to").path("event_id").asText(null),
                content.path("body").asText(""),
                ChannelMessage.ContentType.TEXT,
                null,
                sender,
                displayName(sender),
                Instant.ofEpochMilli(event.path("origin_server_ts").asLong(System.currentTimeMillis())),
                content.path("m.relates_to").path("m.in_reply_to").path("event_id").asText(null),
                null);
    }

    void bind(String homeserver, String accessToken, String userId, ConnectorListener listener) {
        this.homeserver = homeserver;
        this.accessToken = accessToken;
        this.userId = userId;
        this.listener = listener;
        running.set(true);
    }

    private JsonNode get(String path, Map<String, ?> vars) {
        return rest.get()
                .uri(homeserver + path, vars)
                .header("Authorization", "Bearer " + accessToken)
                .retrieve()
                .body(JsonNode.class);
    }

    // @alice:example.org -> alice
    static String displayName(String matrixId) {
        if (matrixId == null || !matrixId.startsWith("@")) return matrixId;
        int colon = matrixId.indexOf(':');
        return colon > 1 ? matrixId.substring(1, colon) : matrixId.substring(1);
    }
}
