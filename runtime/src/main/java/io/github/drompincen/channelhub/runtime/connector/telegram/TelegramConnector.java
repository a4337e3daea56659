package io.github.drompincen.channelhub.runtime.connector.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelAttachment;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnectionConfig;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnector;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.ConnectResult;
import io.github.drompincen.channelhub.runtime.channel.ConnectorListener;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.connector.MessageSplitter;
import io.github.drompincen.channelhub.runtime.connector.ReconnectBackoff;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bot API connector using long polling on {@code getUpdates}. Replies are split at 4096 characters
 * and sent as HTML, falling back to plain text when Telegram rejects the markup.
 */
public class TelegramConnector implements ChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(TelegramConnector.class);

    static final int MAX_MESSAGE_LENGTH = 4096;
    private static final int LABEL_RESERVE = 16;
    private static final int POLL_TIMEOUT_SECONDS = 25;
    private static final long CHUNK_DELAY_MS = 300;

    private final RestClient rest;
    private final String apiBase;
    private final ChannelHubProperties.Reconnect reconnect;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile String token;
    private volatile ConnectorListener listener;
    private volatile Thread poller;
    private long offset;

    public TelegramConnector(RestClient.Builder builder, ChannelHubProperties.Reconnect reconnect, String apiBase) {
        this.rest = builder.build();
        this.reconnect = reconnect;
        this.apiBase = apiBase;
    }

    @Override
    public ChannelType type() {
        return ChannelType.TELEGRAM;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        if (config.accessToken() == null || config.accessToken().isBlank()) {
            throw new CredentialMissingException("Telegram bot token is missing");
        }
        bind(config.accessToken(), listener);

        JsonNode me;
        try {
            me = call("getMe", Map.of());
            boolean dropPending = Boolean.parseBoolean(config.setting("dropPendingUpdates", "false"));
            call("deleteWebhook", Map.of("drop_pending_updates", dropPending));
        } catch (RuntimeException e) {
            running.set(false);
            throw new ConnectorConnectException("Telegram rejected the bot credentials: " + redact(e.getMessage()));
        }

        cancellation.onCancel(() -> running.set(false));
        Thread thread = new Thread(this::pollLoop, "telegram-poll-" + me.path("username").asText("bot"));
        thread.setDaemon(true);
        poller = thread;
        thread.start();

        log.info("Telegram bot @{} started polling", me.path("username").asText());
        return new ConnectResult(me.path("id").asText(null), me.path("username").asText(null));
    }

    void bind(String token, ConnectorListener listener) {
        this.token = token;
        this.listener = listener;
        running.set(true);
    }

    @Override
    public void disconnect() {
        running.set(false);
        Thread thread = poller;
        poller = null;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(Duration.ofSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Telegram bot stopped");
    }

    @Override
    public boolean isConnected() {
        return running.get();
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        if (!isConnected()) {
            throw new DeliveryException("Telegram connector is not connected");
        }
        int limit = content.length() > MAX_MESSAGE_LENGTH ? MAX_MESSAGE_LENGTH - LABEL_RESERVE : MAX_MESSAGE_LENGTH;
        List<String> chunks = MessageSplitter.label(MessageSplitter.split(content, limit));

        String lastId = null;
        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            Map<String, Object> body = new HashMap<>();
            body.put("chat_id", targetId);
            body.put("text", TelegramHtml.toHtml(chunk));
            body.put("parse_mode", "HTML");
            if (i == 0 && isNumeric(options.replyToId())) {
                body.put("reply_to_message_id", Long.parseLong(options.replyToId()));
            }
            if (isNumeric(options.threadId())) {
                body.put("message_thread_id", Long.parseLong(options.threadId()));
            }

            JsonNode sent;
            try {
                sent = call("sendMessage", body);
            } catch (HttpClientErrorException.BadRequest e) {
                log.warn("Telegram refused HTML, resending as plain text");
                body.put("text", TelegramHtml.stripTags(chunk));
                body.remove("parse_mode");
                sent = deliver(body);
            } catch (RuntimeException e) {
                throw new DeliveryException("Telegram sendMessage failed: " + redact(e.getMessage()));
            }
            lastId = sent.path("message_id").asText();

            if (i < chunks.size() - 1) {
                pause(CHUNK_DELAY_MS);
            }
        }
        if (chunks.size() > 1) {
            log.debug("Split Telegram reply into {} parts ({} chars)", chunks.size(), content.length());
        }
        return lastId;
    }

    private JsonNode deliver(Map<String, Object> body) {
        try {
            return call("sendMessage", body);
        } catch (RuntimeException e) {
            throw new DeliveryException("Telegram sendMessage failed: " + redact(e.getMessage()));
        }
    }

    private void pollLoop() {
        ReconnectBackoff backoff = new ReconnectBackoff(reconnect);
        while (running.get()) {
            try {
                pollOnce(POLL_TIMEOUT_SECONDS);
                backoff.reset();
            } catch (RuntimeException e) {
                if (!running.get()) break;
                // 409 means another getUpdates consumer holds this bot
                log.warn("Telegram polling failed (attempt {}): {}", backoff.attempts() + 1, redact(e.getMessage()));
                if (backoff.exhausted()) {
                    running.set(false);
                    listener.onError(new ConnectorConnectException(
                            "Telegram polling gave up after " + backoff.attempts() + " attempts"));
                    break;
                }
                if (!pause(backoff.nextDelay().toMillis())) break;
            }
        }
        log.debug("Telegram poll loop exited");
    }

    void pollOnce(int timeoutSeconds) {
        Map<String, Object> body = new HashMap<>();
        body.put("offset", offset);
        body.put("timeout", timeoutSeconds);
        body.put("allowed_updates", List.of("message"));
        JsonNode updates = call("getUpdates", body);
        for (JsonNode update : updates) {
            offset = update.path("update_id").asLong() + 1;
            try {
                handleUpdate(update);
            } catch (RuntimeException e) {
                log.error("Dropped Telegram update {}: {}", update.path("update_id").asLong(), redact(e.getMessage()), e);
            }
        }
    }

    void handleUpdate(JsonNode update) {
        JsonNode message = update.path("message");
        if (message.isMissingNode() || message.path("message_id").isMissingNode()) return;

        String content = message.has("text") ? message.path("text").asText() : message.path("caption").asText("");
        ChannelMessage.ContentType contentType = ChannelMessage.ContentType.TEXT;
        List<ChannelAttachment> attachments = new ArrayList<>();

        if (message.has("photo") && message.path("photo").size() > 0) {
            JsonNode photo = message.path("photo").get(message.path("photo").size() - 1);
            contentType = ChannelMessage.ContentType.IMAGE;
            attachments.add(new ChannelAttachment("image", fileUrl(photo.path("file_id").asText()), "photo.jpg",
                    photo.path("file_size").asLong(0), "image/jpeg"));
        } else if (message.has("document")) {
            JsonNode doc = message.path("document");
            contentType = ChannelMessage.ContentType.FILE;
            attachments.add(new ChannelAttachment("file", fileUrl(doc.path("file_id").asText()),
                    doc.path("file_name").asText("document"), doc.path("file_size").asLong(0),
                    doc.path("mime_type").asText(null)));
        } else if (message.has("voice")) {
            JsonNode voice = message.path("voice");
            contentType = ChannelMessage.ContentType.VOICE;
            attachments.add(new ChannelAttachment("voice", fileUrl(voice.path("file_id").asText()), "voice.ogg",
                    voice.path("file_size").asLong(0), voice.path("mime_type").asText("audio/ogg")));
        } else if (!message.has("text")) {
            return;
        }

        JsonNode from = message.path("from");
        ChannelMessage normalized = new ChannelMessage(
                message.path("message_id").asText(),
                ChannelType.TELEGRAM,
                message.path("chat").path("id").asText(),
                message.has("message_thread_id") ? message.path("message_thread_id").asText() : null,
                content,
                contentType,
                attachments,
                from.isMissingNode() ? "unknown" : from.path("id").asText(),
                senderName(from),
                Instant.ofEpochSecond(message.path("date").asLong(Instant.now().getEpochSecond())),
                message.path("reply_to_message").has("message_id")
                        ? message.path("reply_to_message").path("message_id").asText() : null,
                Map.of("chatType", message.path("chat").path("type").asText("private")));
        listener.onMessage(normalized);
    }

    private String fileUrl(String fileId) {
        try {
            JsonNode file = call("getFile", Map.of("file_id", fileId));
            return apiBase + "/file/bot" + token + "/" + file.path("file_path").asText();
        } catch (RuntimeException e) {
            log.warn("Could not resolve Telegram file {}: {}", fileId, redact(e.getMessage()));
            return null;
        }
    }

    private JsonNode call(String method, Map<String, ?> body) {
        // the token contains ':' and must reach the path unencoded
        JsonNode response = rest.post()
                .uri(URI.create(apiBase + "/bot" + token + "/" + method))
                .body(body)
                .retrieve()
                .body(JsonNode.class);
        if (response == null || !response.path("ok").asBoolean(false)) {
            String description = response == null ? "empty response" : response.path("description").asText("unknown error");
            throw new TelegramApiException(method + ": " + description);
        }
        return response.path("result");
    }

    private String redact(String text) {
        String t = token;
        return text == null || t == null ? text : text.replace(t, "<token>");
    }

    static String senderName(JsonNode from) {
        if (from == null || from.isMissingNode()) return "Unknown";
        String first = from.path("first_name").asText("");
        if (!first.isEmpty()) {
            String lastName = from.path("last_name").asText("");
            return lastName.isEmpty() ? first : first + " " + lastName;
        }
        return from.path("username").asText("Unknown");
    }

    private static boolean isNumeric(String value) {
        return value != null && value.matches("-?\\d+");
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static class TelegramApiException extends RuntimeException {
        TelegramApiException(String message) {
            super(message);
        }
    }
}
