package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.ChannelType;

/**
 * Wire protocol for one channel type. An instance serves exactly one account and owns its network
 * resource (socket, polling loop, webhook subscription) from {@link #connect} until {@link #disconnect},
 * which must also cancel any pending reconnect or refresh timers.
 *
 * <p>Optional capabilities are expressed by also implementing {@link OAuthCapable} or {@link WebhookCapable}.
 */
public interface ChannelConnector {

    ChannelType type();

    /**
     * Opens the channel. Inbound events are delivered through {@code listener}, serially and in platform order.
     *
     * @throws io.github.drompincen.channelhub.runtime.error.ConnectorConnectException on network or auth failure
     */
    ConnectResult connect(ChannelConnectionConfig config, ConnectorListener listener, CancellationToken cancellation);

    void disconnect();

    boolean isConnected();

    /**
     * @return the platform's id for the delivered message
     * @throws io.github.drompincen.channelhub.runtime.error.DeliveryException if the platform rejected it
     */
    String send(String targetId, String content, SendOptions options);
}
