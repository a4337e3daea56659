package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.ChannelType;
import io.github.drompincen.channelhub.runtime.error.ConnectorConnectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Maps each channel type to the factory that builds its connectors. */
@Component
public class ConnectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final Map<ChannelType, ConnectorFactory> factories = new EnumMap<>(ChannelType.class);

    public ConnectorRegistry(List<ConnectorFactory> factories) {
        for (ConnectorFactory factory : factories) {
            ConnectorFactory previous = this.factories.put(factory.type(), factory);
            if (previous != null) {
                log.warn("Connector factory for {} replaced", factory.type().id());
            }
        }
        log.info("Registered connectors: {}", this.factories.keySet());
    }

    public boolean supports(ChannelType type) {
        return factories.containsKey(type);
    }

    public Set<ChannelType> supportedTypes() {
        return factories.keySet();
    }

    public ChannelConnector create(ChannelType type) {
        ConnectorFactory factory = factories.get(type);
        if (factory == null) {
            throw new ConnectorConnectException("No connector registered for channel type " + type.id());
        }
        return factory.create();
    }

    /** A fresh, unconnected connector for OAuth URL building and code exchange. */
    public Optional<OAuthCapable> oauth(ChannelType type) {
        if (!type.supportsOAuth() || !supports(type)) return Optional.empty();
        return create(type) instanceof OAuthCapable capable ? Optional.of(capable) : Optional.empty();
    }
}
