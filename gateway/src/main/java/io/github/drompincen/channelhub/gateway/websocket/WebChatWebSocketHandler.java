package io.github.drompincen.channelhub.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.ws.WebChatFrame;
import io.github.drompincen.channelhub.protocol.ws.WebChatFrameType;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.connector.webchat.WebChatClient;
import io.github.drompincen.channelhub.runtime.connector.webchat.WebChatConnector;
import io.github.drompincen.channelhub.runtime.connector.webchat.WebChatSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Browser endpoint of the webchat channel at {@code /ws/webchat?channelId=...&sessionId=...}.
 * Browser messages are handed to the connector serving the client's channel id; replies come back
 * through {@link WebChatSessionRegistry}.
 */
@Component
public class WebChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WebChatWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final WebChatSessionRegistry registry;
    private final Map<String, WebChatClient> clients = new ConcurrentHashMap<>();

    public WebChatWebSocketHandler(ObjectMapper objectMapper, WebChatSessionRegistry registry) {
        this.objectMapper = objectMapper;
        this.registry = registry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        MultiValueMap<String, String> query = session.getUri() != null
                ? UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams()
                : null;
        String channelId = query != null ? query.getFirst("channelId") : null;
        String sessionId = query != null && query.getFirst("sessionId") != null
                ? query.getFirst("sessionId") : UUID.randomUUID().toString();

        WebChatClient client = new WebChatClient(session, sessionId, channelId, objectMapper);
        clients.put(session.getId(), client);
        registry.register(client);
        client.send(WebChatFrame.connected(sessionId, channelId));
        log.debug("WebChat session {} opened on {}", sessionId, channelId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebChatClient client = clients.remove(session.getId());
        if (client != null) {
            registry.unregister(client);
            log.debug("WebChat session {} closed ({})", client.sessionId(), status.getCode());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebChatClient client = clients.get(session.getId());
        if (client == null) return;

        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            client.send(WebChatFrame.error("Invalid JSON frame"));
            return;
        }
        WebChatFrameType type = WebChatFrameType.fromWire(node.path("type").asText());
        if (type == null) {
            client.send(WebChatFrame.error("Unknown frame type"));
            return;
        }
        switch (type) {
            case AUTH -> {
                registry.authenticate(client, text(node, "channelId"));
                client.send(WebChatFrame.authSuccess(client.sessionId(), client.channelId()));
            }
            case CHAT_SEND, MESSAGE -> deliver(client, node);
            default -> client.send(WebChatFrame.error("Unexpected frame type " + type.wireName()));
        }
    }

    private void deliver(WebChatClient client, JsonNode node) {
        String content = text(node, "content");
        if (content == null) content = text(node, "text");
        if (content == null) {
            client.send(WebChatFrame.error("Message content is required"));
            return;
        }
        Optional<WebChatConnector> connector = client.channelId() != null
                ? registry.connector(client.channelId()) : Optional.empty();
        if (connector.isEmpty()) {
            client.send(WebChatFrame.error("WebChat channel is not available"));
            return;
        }

        String messageId = text(node, "messageId");
        String senderId = text(node, "userId");
        String senderName = text(node, "userName");
        ChannelMessage inbound = new ChannelMessage(
                messageId != null ? messageId : UUID.randomUUID().toString(),
                ChannelType.WEBCHAT,
                client.channelId(),
                text(node, "threadId"),
                content,
                ChannelMessage.ContentType.TEXT,
                null,
                senderId != null ? senderId : client.sessionId(),
                senderName != null ? senderName : "Web User",
                Instant.now(),
                text(node, "replyTo"),
                Map.of("sessionId", client.sessionId()));
        try {
            connector.get().receive(inbound);
        } catch (RuntimeException e) {
            log.warn("WebChat message from session {} failed: {}", client.sessionId(), e.getMessage());
            client.send(WebChatFrame.error("Message could not be processed"));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String s = value.asText();
        return s.isBlank() ? null : s;
    }
}
