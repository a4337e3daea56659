package io.github.drompincen.channelhub.runtime.connector.webchat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Meeting point between browser sockets (registered by the WebSocket endpoint) and the webchat
 * connector serving each channel id.
 */
@Component
public class WebChatSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(WebChatSessionRegistry.class);

    private final Map<String, Set<WebChatClient>> clients = new ConcurrentHashMap<>();
    private final Map<String, WebChatConnector> connectors = new ConcurrentHashMap<>();

    /** Clients without a channel id are held back until they authenticate with one. */
    public void register(WebChatClient client) {
        if (client.channelId() == null) return;
        clients.computeIfAbsent(client.channelId(), k -> ConcurrentHashMap.newKeySet()).add(client);
        log.debug("WebChat session {} joined {}", client.sessionId(), client.channelId());
    }

    public void unregister(WebChatClient client) {
        if (client.channelId() == null) return;
        clients.computeIfPresent(client.channelId(), (k, set) -> {
            set.remove(client);
            return set.isEmpty() ? null : set;
        });
    }

    /** Moves an authenticating client to the channel it asked for. */
    public void authenticate(WebChatClient client, String channelId) {
        if (channelId != null && !channelId.equals(client.channelId())) {
            unregister(client);
            client.channelId(channelId);
            register(client);
        }
        client.markAuthenticated();
    }

    public List<WebChatClient> clients(String channelId) {
        Set<WebChatClient> set = clients.get(channelId);
        return set == null ? List.of() : List.copyOf(set);
    }

    public Optional<WebChatConnector> connector(String channelId) {
        return Optional.ofNullable(connectors.get(channelId));
    }

    void attach(String channelId, WebChatConnector connector) {
        connectors.put(channelId, connector);
    }

    void detach(String channelId, WebChatConnector connector) {
        connectors.remove(channelId, connector);
    }
}
