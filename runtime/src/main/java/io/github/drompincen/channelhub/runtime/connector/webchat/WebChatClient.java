package io.github.drompincen.channelhub.runtime.connector.webchat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.channelhub.protocol.ws.WebChatFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/** One browser socket. Clients that sent {@code auth} get the streaming frames, others the legacy one. */
public class WebChatClient {

    private static final Logger log = LoggerFactory.getLogger(WebChatClient.class);

    private final WebSocketSession session;
    private final String sessionId;
    private final ObjectMapper objectMapper;
    private volatile String channelId;
    private volatile boolean authenticated;

    public WebChatClient(WebSocketSession session, String sessionId, String channelId, ObjectMapper objectMapper) {
        this.session = session;
        this.sessionId = sessionId;
        this.channelId = channelId;
        this.objectMapper = objectMapper;
    }

    public String sessionId() { return sessionId; }
    public String channelId() { return channelId; }
    public boolean authenticated() { return authenticated; }
    public boolean isOpen() { return session.isOpen(); }

    void channelId(String channelId) { this.channelId = channelId; }
    void markAuthenticated() { this.authenticated = true; }

    public void send(WebChatFrame frame) {
        if (!session.isOpen()) return;
        try {
            String json = objectMapper.writeValueAsString(frame);
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.warn("WebChat send to session {} failed: {}", sessionId, e.getMessage());
        }
    }

    void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Closing WebChat session {} failed: {}", sessionId, e.getMessage());
        }
    }
}
