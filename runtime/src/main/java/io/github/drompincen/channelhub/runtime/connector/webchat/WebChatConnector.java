package io.github.drompincen.channelhub.runtime.connector.webchat;

import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.protocol.ws.WebChatFrame;
import io.github.drompincen.channelhub.runtime.channel.CancellationToken;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnectionConfig;
import io.github.drompincen.channelhub.runtime.channel.ChannelConnector;
import io.github.drompincen.channelhub.runtime.channel.ChannelMessage;
import io.github.drompincen.channelhub.runtime.channel.ConnectResult;
import io.github.drompincen.channelhub.runtime.channel.ConnectorListener;
import io.github.drompincen.channelhub.runtime.channel.SendOptions;
import io.github.drompincen.channelhub.runtime.error.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;

import java.util.UUID;

/**
 * Browser widget channel. The sockets themselves belong to the application's {@code /ws/webchat}
 * endpoint; this connector claims one channel id in {@link WebChatSessionRegistry} and fans replies
 * out to every client on it.
 */
public class WebChatConnector implements ChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(WebChatConnector.class);

    private final WebChatSessionRegistry registry;
    private volatile String channelId;
    private volatile ConnectorListener listener;

    public WebChatConnector(WebChatSessionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBCHAT;
    }

    @Override
    public ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation) {
        this.channelId = config.channelId();
        this.listener = listener;
        registry.attach(channelId, this);
        log.info("WebChat channel {} open", channelId);
        return new ConnectResult(config.accountId(), "WebChat");
    }

    @Override
    public void disconnect() {
        String id = channelId;
        listener = null;
        if (id != null) {
            registry.detach(id, this);
            registry.clients(id).forEach(c -> c.close(CloseStatus.GOING_AWAY));
            log.info("WebChat channel {} closed", id);
        }
    }

    @Override
    public boolean isConnected() {
        return listener != null;
    }

    /** Called by the socket endpoint for each message a browser sends. */
    public void receive(ChannelMessage message) {
        ConnectorListener current = listener;
        if (current == null) {
            throw new IllegalStateException("WebChat channel " + message.channelId() + " is not connected");
        }
        current.onMessage(message);
    }

    @Override
    public String send(String targetId, String content, SendOptions options) {
        if (!isConnected()) {
            throw new DeliveryException("WebChat channel is not connected");
        }
        String messageId = UUID.randomUUID().toString();
        WebChatFrame legacy = WebChatFrame.legacyMessage(messageId, content, options.threadId(), options.replyToId());
        int delivered = 0;
        for (WebChatClient client : registry.clients(targetId)) {
            if (!client.isOpen()) continue;
            if (client.authenticated()) {
                client.send(WebChatFrame.start(messageId));
                client.send(WebChatFrame.chunk(messageId, content));
                client.send(WebChatFrame.end(messageId));
            } else {
                client.send(legacy);
            }
            delivered++;
        }
        log.debug("WebChat reply {} delivered to {} client(s) on {}", messageId, delivered, targetId);
        return messageId;
    }
}
