package io.github.drompincen.channelhub.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnectionConfig;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.ConnectorListener;
import io.github.drompincen.channelhub.runtime.connector.webchat.WebChatConnector;
import io.github.drompincen.channelhub.runtime.connector.webchat.WebChatSessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WebChatWebSocketHandlerTest {

    private static final String CHANNEL = "webchat:u1";

    @Mock private WebSocketSession wsSession;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final WebChatSessionRegistry registry = new WebChatSessionRegistry();
    private final List<ChannelMessage> received = new CopyOnWriteArrayList<>();
    private WebChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new WebChatWebSocketHandler(objectMapper, registry);
        when(wsSession.getId()).thenReturn("ws-1");
        when(wsSession.isOpen()).thenReturn(true);
    }

    private void connectChannel() {
        new WebChatConnector(registry).connect(new ChannelConnectionConfig("u1", "acc-1", ChannelType.WEBCHAT,
                CHANNEL, "webchat", null, null, null), new ConnectorListener() {
            @Override
            public void onMessage(ChannelMessage message) {
                received.add(message);
            }

            @Override
            public void onError(Throwable error) {
                throw new AssertionError(error);
            }
        }, new CancellationToken());
    }

    private void open(String query) {
        when(wsSession.getUri()).thenReturn(URI.create("ws://localhost:8080/ws/webchat" + query));
        handler.afterConnectionEstablished(wsSession);
    }

    private List<JsonNode> sentFrames(int count) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(wsSession, times(count)).sendMessage(captor.capture());
        List<JsonNode> frames = new java.util.ArrayList<>();
        for (TextMessage m : captor.getAllValues()) {
            frames.add(objectMapper.readTree(m.getPayload()));
        }
        return frames;
    }

    @Test
    void connectedFrameCarriesSessionAndChannel() throws Exception {
        open("?channelId=" + CHANNEL + "&sessionId=s-1");

        JsonNode frame = sentFrames(1).get(0);
        assertThat(frame.path("type").asText()).isEqualTo("connected");
        assertThat(frame.path("sessionId").asText()).isEqualTo("s-1");
        assertThat(frame.path("channelId").asText()).isEqualTo(CHANNEL);
        assertThat(registry.clients(CHANNEL)).hasSize(1);
    }

    @Test
    void missingSessionIdIsGenerated() throws Exception {
        open("");

        assertThat(sentFrames(1).get(0).path("sessionId").asText()).isNotBlank();
    }

    @Test
    void chatSendReachesTheChannelConnector() throws Exception {
        connectChannel();
        open("?channelId=" + CHANNEL + "&sessionId=s-1");

        handler.handleTextMessage(wsSession, new TextMessage(
                "{\"type\":\"chat.send\",\"content\":\"hello\",\"messageId\":\"m-1\",\"userName\":\"Ada\"}"));

        assertThat(received).singleElement().satisfies(m -> {
            assertThat(m.id()).isEqualTo("m-1");
            assertThat(m.content()).isEqualTo("hello");
            assertThat(m.channelId()).isEqualTo(CHANNEL);
            assertThat(m.senderId()).isEqualTo("s-1");
            assertThat(m.senderName()).isEqualTo("Ada");
            assertThat(m.metadata()).containsEntry("sessionId", "s-1");
        });
    }

    @Test
    void legacyMessageFrameUsesTextField() throws Exception {
        connectChannel();
        open("?channelId=" + CHANNEL);

        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"message\",\"text\":\"hi there\"}"));

        assertThat(received).extracting(ChannelMessage::content).containsExactly("hi there");
        assertThat(received.get(0).senderName()).isEqualTo("Web User");
    }

    @Test
    void authMovesClientToRequestedChannel() throws Exception {
        open("?sessionId=s-1");

        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"auth\",\"channelId\":\"" + CHANNEL + "\"}"));

        List<JsonNode> frames = sentFrames(2);
        assertThat(frames.get(1).path("type").asText()).isEqualTo("auth_success");
        assertThat(registry.clients(CHANNEL)).singleElement()
                .satisfies(c -> assertThat(c.authenticated()).isTrue());
    }

    @Test
    void messageForUnavailableChannelGetsError() throws Exception {
        open("?channelId=" + CHANNEL);

        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"chat.send\",\"content\":\"hello\"}"));

        JsonNode error = sentFrames(2).get(1);
        assertThat(error.path("type").asText()).isEqualTo("error");
        assertThat(error.path("content").asText()).contains("not available");
    }

    @Test
    void invalidFramesAreAnsweredWithErrors() throws Exception {
        connectChannel();
        open("?channelId=" + CHANNEL);

        handler.handleTextMessage(wsSession, new TextMessage("not json"));
        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"subscribe\"}"));
        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"chat.send\"}"));
        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"chat.end\"}"));

        List<JsonNode> frames = sentFrames(5);
        assertThat(frames.subList(1, 5)).allSatisfy(f -> assertThat(f.path("type").asText()).isEqualTo("error"));
        assertThat(received).isEmpty();
    }

    @Test
    void closingUnregistersTheClient() {
        open("?channelId=" + CHANNEL);

        handler.afterConnectionClosed(wsSession, CloseStatus.NORMAL);

        assertThat(registry.clients(CHANNEL)).isEmpty();
    }
}
