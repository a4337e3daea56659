package io.github.drompincen.channelhub.runtime.connector.matrix;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnectionConfig;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import io.github.drompincen.channelhub.runtime.connector.RecordingListener;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import io.github.drompincen.channelhub.runtime.error.CredentialMissingException;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.http.HttpMethod.PUT;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

class MatrixConnectorTest {

    private static final String HOMESERVER = "https://matrix.example.org";

    private final ObjectMapper mapper = new ObjectMapper();
    private MockRestServiceServer server;
    private MatrixConnector connector;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        connector = new MatrixConnector(builder, new ChannelHubProperties.Reconnect(1, null, null));
        listener = new RecordingListener();
    }

    @Test
    void connectRequiresHomeserverAndToken() {
        ChannelConnectionConfig config = new ChannelConnectionConfig("u1", "acc-1", ChannelType.MATRIX, "matrix",
                "@bot:example.org", "token", null, Map.of());

        assertThatThrownBy(() -> connector.connect(config, listener, new CancellationToken()))
                .isInstanceOf(CredentialMissingException.class);
    }

    @Test
    void connectFailsWhenHomeserverRejectsToken() {
        server.expect(requestTo(HOMESERVER + "/_matrix/client/v3/account/whoami")).andRespond(withUnauthorizedRequest());
        ChannelConnectionConfig config = new ChannelConnectionConfig("u1", "acc-1", ChannelType.MATRIX, "matrix",
                "@bot:example.org", "token", null, Map.of("homeserverUrl", HOMESERVER + "/"));

        assertThatThrownBy(() -> connector.connect(config, listener, new CancellationToken()))
                .isInstanceOf(ConnectorConnectException.class);
        assertThat(connector.isConnected()).isFalse();
    }

    @Test
    void dispatchesTextMessagesFromJoinedRooms() throws Exception {
        connector.bind(HOMESERVER, "token", "@bot:example.org", listener);

        connector.handleSync(mapper.readTree("""
                {"next_batch":"s2","rooms":{"join":{"!room:example.org":{"timeline":{"events":[
                  {"type":"m.room.message","event_id":"$e1","sender":"@alice:example.org","origin_server_ts":1700000000000,
                   "content":{"msgtype":"m.text","body":"hello",
                              "m.relates_to":{"m.in_reply_to":{"event_id":"$e0"}}}},
                  {"type":"m.room.message","event_id":"$e2","sender":"@bot:example.org",
                   "content":{"msgtype":"m.text","body":"echo"}},
                  {"type":"m.room.message","event_id":"$e3","sender":"@alice:example.org",
                   "content":{"msgtype":"m.image","body":"cat.png"}},
                  {"type":"m.room.member","event_id":"$e4","sender":"@carol:example.org","content":{}}
                ]}}}}}
                """));

        assertThat(listener.messages).hasSize(1);
        ChannelMessage message = listener.messages.get(0);
        assertThat(message.id()).isEqualTo("$e1");
        assertThat(message.channelType()).isEqualTo(ChannelType.MATRIX);
        assertThat(message.channelId()).isEqualTo("!room:example.org");
        assertThat(message.senderName()).isEqualTo("alice");
        assertThat(message.replyToId()).isEqualTo("$e0");
        assertThat(message.timestamp()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
    }

    @Test
    void failingEventDoesNotDropTheRestOfTheSync() throws Exception {
        RecordingListener failingOnFirst = new RecordingListener() {
            @Override
            public void onMessage(ChannelMessage message) {
                if ("$e1".equals(message.id())) {
                    throw new IllegalStateException("mongo down");
                }
                super.onMessage(message);
            }
        };
        connector.bind(HOMESERVER, "token", "@bot:example.org", failingOnFirst);

        connector.handleSync(mapper.readTree("""
                {"rooms":{"join":{"!room:example.org":{"timeline":{"events":[
                  {"type":"m.room.message","event_id":"$e1","sender":"@alice:example.org",
                   "content":{"msgtype":"m.text","body":"one"}},
                  {"type":"m.room.message","event_id":"$e2","sender":"@alice:example.org",
                   "content":{"msgtype":"m.text","body":"two"}}
                ]}}}}}
                """));

        assertThat(failingOnFirst.messages).extracting(ChannelMessage::id).containsExactly("$e2");
        assertThat(connector.isConnected()).isTrue();
    }

    @Test
    void sendsRoomMessageWithReplyRelation() {
        connector.bind(HOMESERVER, "token", "@bot:example.org", listener);
        server.expect(requestTo(startsWith(HOMESERVER + "/_matrix/client/v3/rooms/%21room%3Aexample.org/send/m.room.message/")))
                .andExpect(method(PUT))
                .andExpect(header("Authorization", "Bearer token"))
                .andExpect(jsonPath("$.msgtype").value("m.text"))
                .andExpect(jsonPath("$['m.relates_to']['m.in_reply_to'].event_id").value("$e1"))
                .andRespond(withSuccess("{\"event_id\":\"$e9\"}", MediaType.APPLICATION_JSON));

        assertThat(connector.send("!room:example.org", "hi", new SendOptions(null, "$e1"))).isEqualTo("$e9");
        server.verify();
    }

    @Test
    void refusesToSendWhileDisconnected() {
        assertThatThrownBy(() -> connector.send("!room:example.org", "hi", SendOptions.none()))
                .isInstanceOf(DeliveryException.class);
    }

    @Test
    void derivesDisplayNameFromMatrixId() {
        assertThat(MatrixConnector.displayName("@alice:example.org")).isEqualTo("alice");
        assertThat(MatrixConnector.displayName("plain")).isEqualTo("plain");
    }
}
