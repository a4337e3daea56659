package io.github.drompincen.channelhub.runtime.channel;

import io.github.drompincen.channelhub.protocol.api.PairingStateDto;

public interface ConnectorListener {

    void onMessage(ChannelMessage message);

    /** Failures after a successful connect, e.g. a socket lost for good after reconnect attempts ran out. */
    void onError(Throwable error);

    default void onPairingUpdate(PairingStateDto state) {}
}
